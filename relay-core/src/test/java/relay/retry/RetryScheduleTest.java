package relay.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RetryScheduleTest {
  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

  @Test
  void defaultsBackOffThenRetryHourly() {
    RetrySchedule schedule = RetrySchedule.defaults();
    Instant failedAt = START.plusSeconds(30);

    long[] expected = {1, 2, 4, 8, 16};
    for (int retry = 1; retry <= 5; retry++) {
      assertEquals(failedAt.plusSeconds(expected[retry - 1]),
          schedule.nextAttemptAt(retry, START, failedAt).orElseThrow(), "retry " + retry);
    }
    assertEquals(failedAt.plus(Duration.ofHours(1)), schedule.nextAttemptAt(6, START, failedAt).orElseThrow());
    assertEquals(failedAt.plus(Duration.ofHours(1)), schedule.nextAttemptAt(20, START, failedAt).orElseThrow());
  }

  @Test
  void failureAtEndOfWindowDeadLetters() {
    RetrySchedule schedule = RetrySchedule.defaults();

    assertTrue(schedule.nextAttemptAt(25, START, START.plus(Duration.ofHours(24))).isEmpty());
    assertTrue(schedule.nextAttemptAt(2, START, START.plus(Duration.ofHours(30))).isEmpty());
  }

  @Test
  void nextAttemptNeverFallsOutsideTheWindow() {
    RetrySchedule schedule = RetrySchedule.defaults();
    Instant windowEnd = START.plus(Duration.ofHours(24));

    Instant lastHourly = START.plus(Duration.ofHours(23)).plusSeconds(31);
    assertTrue(schedule.nextAttemptAt(28, START, lastHourly).isEmpty(), "an hour later is past the window");
    assertTrue(schedule.nextAttemptAt(24, START, windowEnd.minus(Duration.ofHours(1))).isEmpty(),
        "an hour later is exactly the window end");

    Instant justInside = windowEnd.minus(Duration.ofHours(1)).minusMillis(1);
    assertEquals(windowEnd.minusMillis(1), schedule.nextAttemptAt(24, START, justInside).orElseThrow());
    assertTrue(schedule.nextAttemptAt(1, START, windowEnd.minusMillis(500)).isEmpty(),
        "even a one second backoff must fit");
  }

  @Test
  void customScheduleHonoursAllSettings() {
    RetrySchedule schedule = RetrySchedule.builder()
        .baseDelay(Duration.ofMillis(100))
        .backoffAttempts(2)
        .extendedInterval(Duration.ofSeconds(5))
        .retryWindow(Duration.ofMinutes(1))
        .build();

    assertEquals(START.plusMillis(100), schedule.nextAttemptAt(1, START, START).orElseThrow());
    assertEquals(START.plusMillis(200), schedule.nextAttemptAt(2, START, START).orElseThrow());
    assertEquals(START.plusSeconds(5), schedule.nextAttemptAt(3, START, START).orElseThrow());
    assertTrue(schedule.isExhausted(START, START.plusSeconds(60)));
  }

  @Test
  void builderRejectsNonPositiveDurations() {
    assertThrows(IllegalArgumentException.class, () -> RetrySchedule.builder().baseDelay(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () -> RetrySchedule.builder().backoffAttempts(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> RetrySchedule.builder().extendedInterval(Duration.ofSeconds(-1)).build());
    assertThrows(IllegalArgumentException.class, () -> RetrySchedule.builder().retryWindow(Duration.ZERO).build());
  }
}
