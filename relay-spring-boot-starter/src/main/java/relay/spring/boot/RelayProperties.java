package relay.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the CRM relay.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * Whether the relay is wired at all.
     */
    private boolean enabled = true;

    /**
     * Upper bound for draining worker pools on shutdown.
     */
    private Duration drainTimeout = Duration.ofSeconds(5);

    private final Outbound outbound = new Outbound();
    private final Retry retry = new Retry();
    private final Webhook webhook = new Webhook();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    public Outbound getOutbound() {
        return outbound;
    }

    public Retry getRetry() {
        return retry;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Platform sends made by the outbound dispatcher.
     */
    public static class Outbound {
        private int workerCount = 4;
        private int maxRetries = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration pendingGrace = Duration.ofSeconds(30);

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getPendingGrace() {
            return pendingGrace;
        }

        public void setPendingGrace(Duration pendingGrace) {
            this.pendingGrace = pendingGrace;
        }
    }

    /**
     * Webhook retry engine.
     */
    public static class Retry {
        private Duration tickInterval = Duration.ofSeconds(1);
        private int batchSize = 50;
        private int workerCount = 4;
        private Duration baseDelay = Duration.ofSeconds(1);
        private int backoffAttempts = 5;
        private Duration extendedInterval = Duration.ofHours(1);
        private Duration retryWindow = Duration.ofHours(24);
        private Duration deliveringLease = Duration.ofMinutes(5);

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public int getBackoffAttempts() {
            return backoffAttempts;
        }

        public void setBackoffAttempts(int backoffAttempts) {
            this.backoffAttempts = backoffAttempts;
        }

        public Duration getExtendedInterval() {
            return extendedInterval;
        }

        public void setExtendedInterval(Duration extendedInterval) {
            this.extendedInterval = extendedInterval;
        }

        public Duration getRetryWindow() {
            return retryWindow;
        }

        public void setRetryWindow(Duration retryWindow) {
            this.retryWindow = retryWindow;
        }

        public Duration getDeliveringLease() {
            return deliveringLease;
        }

        public void setDeliveringLease(Duration deliveringLease) {
            this.deliveringLease = deliveringLease;
        }
    }

    /**
     * Outgoing webhook requests.
     */
    public static class Webhook {
        private Duration immediateTimeout = Duration.ofSeconds(2);
        private Duration attemptTimeout = Duration.ofSeconds(5);
        private String userAgent = "crm-relay/1.0";

        public Duration getImmediateTimeout() {
            return immediateTimeout;
        }

        public void setImmediateTimeout(Duration immediateTimeout) {
            this.immediateTimeout = immediateTimeout;
        }

        public Duration getAttemptTimeout() {
            return attemptTimeout;
        }

        public void setAttemptTimeout(Duration attemptTimeout) {
            this.attemptTimeout = attemptTimeout;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "relay";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
