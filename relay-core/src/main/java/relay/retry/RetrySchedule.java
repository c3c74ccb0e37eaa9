package relay.retry;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * When a failed webhook delivery is tried again.
 *
 * <p>Three phases, measured from the start of the delivery's retry window:
 * <ol>
 *   <li>backoff: retries {@code 1..backoffAttempts} wait {@code base * 2^(n-1)}
 *       after the failed attempt;</li>
 *   <li>extended: later retries wait {@code extendedInterval};</li>
 *   <li>exhausted: a failure whose next attempt would fall at or after
 *       {@code windowStart + retryWindow} dead-letters the delivery.</li>
 * </ol>
 *
 * <p>Every attempt therefore happens inside the retry window.
 */
public final class RetrySchedule {
  private final RetryPolicy backoff;
  private final int backoffAttempts;
  private final Duration extendedInterval;
  private final Duration retryWindow;

  private RetrySchedule(Builder builder) {
    if (builder.baseDelay.isNegative() || builder.baseDelay.isZero()) {
      throw new IllegalArgumentException("baseDelay must be > 0");
    }
    if (builder.backoffAttempts < 0) {
      throw new IllegalArgumentException("backoffAttempts must be >= 0");
    }
    Objects.requireNonNull(builder.extendedInterval, "extendedInterval");
    Objects.requireNonNull(builder.retryWindow, "retryWindow");
    if (builder.extendedInterval.isNegative() || builder.extendedInterval.isZero()) {
      throw new IllegalArgumentException("extendedInterval must be > 0");
    }
    if (builder.retryWindow.isNegative() || builder.retryWindow.isZero()) {
      throw new IllegalArgumentException("retryWindow must be > 0");
    }
    long baseMs = builder.baseDelay.toMillis();
    long maxBackoffMs = builder.backoffAttempts == 0
        ? baseMs
        : new ExponentialBackoffRetryPolicy(baseMs, Long.MAX_VALUE).computeDelayMs(builder.backoffAttempts);
    this.backoff = new ExponentialBackoffRetryPolicy(baseMs, maxBackoffMs);
    this.backoffAttempts = builder.backoffAttempts;
    this.extendedInterval = builder.extendedInterval;
    this.retryWindow = builder.retryWindow;
  }

  /** 1, 2, 4, 8, 16 seconds, then hourly until 24 hours have passed. */
  public static RetrySchedule defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Computes when to try again after a failed attempt.
   *
   * @param retries         the delivery's retry count including this failure
   * @param windowStartedAt start of the retry window
   * @param attemptedAt     when the failed attempt was made
   * @return the next attempt time, or empty if it would not fall inside the retry window
   *         and the delivery should be dead-lettered
   */
  public Optional<Instant> nextAttemptAt(int retries, Instant windowStartedAt, Instant attemptedAt) {
    Instant next = retries <= backoffAttempts
        ? attemptedAt.plusMillis(backoff.computeDelayMs(retries))
        : attemptedAt.plus(extendedInterval);
    if (isExhausted(windowStartedAt, next)) {
      return Optional.empty();
    }
    return Optional.of(next);
  }

  /**
   * Returns whether the retry window that started at {@code windowStartedAt} is over.
   */
  public boolean isExhausted(Instant windowStartedAt, Instant now) {
    return !now.isBefore(windowStartedAt.plus(retryWindow));
  }

  public int backoffAttempts() {
    return backoffAttempts;
  }

  public Duration extendedInterval() {
    return extendedInterval;
  }

  public Duration retryWindow() {
    return retryWindow;
  }

  /** Builder for {@link RetrySchedule}. */
  public static final class Builder {
    private Duration baseDelay = Duration.ofSeconds(1);
    private int backoffAttempts = 5;
    private Duration extendedInterval = Duration.ofHours(1);
    private Duration retryWindow = Duration.ofHours(24);

    private Builder() {}

    /**
     * Delay after the first failure. Optional, defaults to 1 second.
     */
    public Builder baseDelay(Duration baseDelay) {
      this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
      return this;
    }

    /**
     * Number of retries that use exponential backoff. Optional, defaults to 5.
     */
    public Builder backoffAttempts(int backoffAttempts) {
      this.backoffAttempts = backoffAttempts;
      return this;
    }

    /**
     * Fixed delay once backoff is exhausted. Optional, defaults to 1 hour.
     */
    public Builder extendedInterval(Duration extendedInterval) {
      this.extendedInterval = extendedInterval;
      return this;
    }

    /**
     * Time after which a still failing delivery is dead-lettered. Optional, defaults to 24 hours.
     */
    public Builder retryWindow(Duration retryWindow) {
      this.retryWindow = retryWindow;
      return this;
    }

    public RetrySchedule build() {
      return new RetrySchedule(this);
    }
  }
}
