/**
 * Self-healing queue consumers with manual acknowledgement.
 *
 * @see io.courier.consume.EventConsumer
 * @see io.courier.consume.ConsumerState
 */
package io.courier.consume;
