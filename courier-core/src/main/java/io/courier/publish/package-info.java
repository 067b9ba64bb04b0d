/**
 * Asynchronous batching publisher.
 *
 * @see io.courier.publish.EventPublisher
 */
package io.courier.publish;
