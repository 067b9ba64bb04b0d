package io.courier.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as the handler of a durable queue.
 *
 * <p>The annotated bean must implement {@link io.courier.consume.EventHandler}. At startup
 * the queue is declared, bound to {@link #exchange()} under every key in
 * {@link #routingKeys()}, and consumed by the bean.
 *
 * <pre>{@code
 * @Component
 * @CourierListener(queue = "auth_service_user_events", exchange = "user_events",
 *     routingKeys = {"user.*"})
 * public class UserEventsHandler implements EventHandler {
 *   public void handle(Map<String, Object> payload) { ... }
 * }
 * }</pre>
 *
 * @see io.courier.consume.EventHandler
 * @see CourierListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CourierListener {

    /**
     * Durable queue name.
     */
    String queue();

    /**
     * Exchange the queue is bound to.
     */
    String exchange();

    /**
     * Binding keys. At least one is required; {@code *} and {@code #} wildcards apply.
     */
    String[] routingKeys();
}
