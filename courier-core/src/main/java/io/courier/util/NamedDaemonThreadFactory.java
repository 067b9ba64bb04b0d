package io.courier.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates daemon threads named {@code <prefix>1}, {@code <prefix>2}, ... so that
 * publisher and consumer threads never keep the JVM alive and show up clearly in
 * thread dumps. Uncaught exceptions are logged instead of printed to stderr.
 */
public final class NamedDaemonThreadFactory implements ThreadFactory {
  private static final Logger logger = Logger.getLogger(NamedDaemonThreadFactory.class.getName());

  private final String prefix;
  private final AtomicInteger sequence = new AtomicInteger(1);

  public NamedDaemonThreadFactory(String prefix) {
    this.prefix = Objects.requireNonNull(prefix, "prefix");
  }

  @Override
  public Thread newThread(Runnable task) {
    Thread thread = new Thread(task, prefix + sequence.getAndIncrement());
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, e) ->
        logger.log(Level.SEVERE, "Uncaught exception in thread " + t.getName(), e));
    return thread;
  }
}
