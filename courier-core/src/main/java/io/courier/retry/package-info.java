/**
 * Backoff policies injected into the connection pool, publisher and consumers.
 */
package io.courier.retry;
