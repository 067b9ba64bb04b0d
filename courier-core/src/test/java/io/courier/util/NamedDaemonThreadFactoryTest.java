package io.courier.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamedDaemonThreadFactoryTest {

    @Test
    void threadsAreDaemonsWithSequentialNames() {
        NamedDaemonThreadFactory factory = new NamedDaemonThreadFactory("courier-test-");

        Thread first = factory.newThread(() -> {});
        Thread second = factory.newThread(() -> {});

        assertTrue(first.isDaemon());
        assertEquals("courier-test-1", first.getName());
        assertEquals("courier-test-2", second.getName());
        assertNotNull(first.getUncaughtExceptionHandler());
    }
}
