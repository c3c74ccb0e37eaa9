package relay.spi;

/**
 * Observability hook for exporting relay counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of new outbound messages accepted for sending.
     */
    void incrementSendAccepted();

    /**
     * Increments the count of send requests answered from an existing idempotency key.
     */
    void incrementSendDuplicate();

    /**
     * Increments the count of outbound messages confirmed by the platform.
     */
    void incrementSendSucceeded();

    /**
     * Increments the count of platform calls that failed transiently and were rescheduled.
     */
    void incrementSendRetried();

    /**
     * Increments the count of outbound messages that ended in {@code failed}.
     */
    void incrementSendFailed();

    /**
     * Increments the count of inbound platform events persisted.
     */
    void incrementInboundReceived();

    /**
     * Increments the count of inbound platform events ignored as duplicates.
     */
    default void incrementInboundDuplicate() {
    }

    /**
     * Increments the count of webhooks the CRM accepted.
     */
    void incrementWebhookDelivered();

    /**
     * Increments the count of failed webhook attempts that will be retried.
     */
    void incrementWebhookRetried();

    /**
     * Increments the count of webhook deliveries rejected with 401/403.
     */
    void incrementWebhookAuthFailed();

    /**
     * Increments the count of webhook deliveries moved to the dead-letter queue.
     */
    void incrementWebhookDeadLettered();

    /**
     * Records how many deliveries the last retry tick found due.
     *
     * @param count number of due deliveries (always non-negative)
     */
    default void recordDueDeliveries(int count) {
    }

    /**
     * Records the duration of one webhook HTTP attempt.
     *
     * @param durationMs attempt duration in milliseconds (always non-negative)
     */
    default void recordWebhookAttemptMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementSendAccepted() {
        }

        @Override
        public void incrementSendDuplicate() {
        }

        @Override
        public void incrementSendSucceeded() {
        }

        @Override
        public void incrementSendRetried() {
        }

        @Override
        public void incrementSendFailed() {
        }

        @Override
        public void incrementInboundReceived() {
        }

        @Override
        public void incrementWebhookDelivered() {
        }

        @Override
        public void incrementWebhookRetried() {
        }

        @Override
        public void incrementWebhookAuthFailed() {
        }

        @Override
        public void incrementWebhookDeadLettered() {
        }
    }
}
