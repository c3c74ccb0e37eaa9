package relay.retry;

/**
 * Strategy for computing the delay before retrying a failed attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next retry attempt.
     *
     * @param retries the number of failed attempts so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retries);
}
