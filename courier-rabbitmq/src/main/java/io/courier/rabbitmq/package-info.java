/**
 * RabbitMQ implementation of the broker SPI, built on the official
 * {@code com.rabbitmq:amqp-client}.
 *
 * @see io.courier.rabbitmq.RabbitBrokerConnectionFactory
 */
package io.courier.rabbitmq;
