/**
 * Service provider interfaces: the broker abstraction
 * ({@link io.courier.spi.BrokerConnectionFactory}, {@link io.courier.spi.BrokerConnection},
 * {@link io.courier.spi.BrokerChannel}) implemented by {@code courier-rabbitmq}, and the
 * {@link io.courier.spi.MetricsExporter} hook implemented by {@code courier-micrometer}.
 */
package io.courier.spi;
