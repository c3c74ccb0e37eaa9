package relay.retry;

/**
 * Deterministic exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(retries-1)}, capped at {@code maxDelay}. With a
 * base of one second the delays are 1, 2, 4, 8, 16 seconds. There is no jitter: retry
 * times are recorded in the status store and must be predictable.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int retries) {
    if (retries <= 0) {
      return 0L;
    }
    if (retries >= 63) {
      return maxDelayMs;
    }
    long shift = 1L << (retries - 1);
    // Overflow guard: once the multiplier passes maxDelay/baseDelay the cap applies
    if (shift > maxDelayMs / baseDelayMs) {
      return maxDelayMs;
    }
    return Math.min(maxDelayMs, baseDelayMs * shift);
  }
}
