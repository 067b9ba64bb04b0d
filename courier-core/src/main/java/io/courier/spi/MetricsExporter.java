package io.courier.spi;

/**
 * Observability hook for exporting messaging and session counters and gauges.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system. Implementations must be
 * thread-safe; methods are called from publisher, consumer and caller threads.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events accepted into the outbound queue.
     */
    void incrementPublishAccepted();

    /**
     * Increments the count of events handed to the broker.
     */
    void incrementPublishSuccess();

    /**
     * Increments the count of events whose publish attempt failed (not retried).
     */
    void incrementPublishFailure();

    /**
     * Increments the count of batches put back on the queue because no connection
     * could be obtained.
     */
    void incrementBatchRequeued();

    /**
     * Records the number of events waiting in the outbound queue.
     *
     * @param depth current queue depth
     */
    void recordOutboundQueueDepth(int depth);

    /**
     * Increments the count of deliveries acknowledged after successful handling.
     */
    void incrementDeliveryAcked();

    /**
     * Increments the count of deliveries negatively acknowledged with requeue.
     */
    void incrementDeliveryRequeued();

    /**
     * Increments the count of deliveries rejected without requeue after reaching the
     * delivery attempt cap.
     */
    default void incrementDeliveryRejected() {
    }

    /**
     * Increments the count of consumer reconnect cycles.
     */
    default void incrementConsumerReconnect() {
    }

    /**
     * Records the state of the connection pool.
     *
     * @param live number of live connections (idle and checked out)
     * @param idle number of idle connections
     */
    default void recordPoolState(int live, int idle) {
    }

    /**
     * Records the number of database sessions currently open.
     *
     * @param inFlight open session count
     */
    default void recordSessionsInFlight(int inFlight) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublishAccepted() {
        }

        @Override
        public void incrementPublishSuccess() {
        }

        @Override
        public void incrementPublishFailure() {
        }

        @Override
        public void incrementBatchRequeued() {
        }

        @Override
        public void recordOutboundQueueDepth(int depth) {
        }

        @Override
        public void incrementDeliveryAcked() {
        }

        @Override
        public void incrementDeliveryRequeued() {
        }
    }
}
