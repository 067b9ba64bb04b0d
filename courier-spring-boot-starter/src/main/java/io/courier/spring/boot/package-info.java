/**
 * Spring Boot auto-configuration for courier.
 *
 * <p>{@link io.courier.spring.boot.CourierAutoConfiguration} wires a
 * {@link io.courier.Courier} from {@code courier.*} application properties and, when a
 * {@code DataSource} exists, a {@link io.courier.jdbc.session.SessionManager}.
 *
 * <p>Use {@link io.courier.spring.boot.CourierListener @CourierListener} on
 * {@link io.courier.consume.EventHandler} beans to subscribe queues declaratively.
 *
 * @see io.courier.spring.boot.CourierAutoConfiguration
 * @see io.courier.spring.boot.CourierProperties
 * @see io.courier.spring.boot.CourierListener
 * @see io.courier.spring.boot.CourierListenerRegistrar
 */
package io.courier.spring.boot;
