package com.tradefeed.integration.binance;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.junit.jupiter.api.Test;

class JitteredExponentialBackoffTest {
  @Test
  void shouldDoubleFromBaseUntilCappedWhenJitterIsZero() {
    JitteredExponentialBackoff backoff =
        new JitteredExponentialBackoff(
            Duration.ofMillis(100L), Duration.ofMillis(500L), 0.1d, () -> 0.0d);

    assertEquals(Duration.ofMillis(100L), backoff.backoffForRetry(0));
    assertEquals(Duration.ofMillis(200L), backoff.backoffForRetry(1));
    assertEquals(Duration.ofMillis(400L), backoff.backoffForRetry(2));
    assertEquals(Duration.ofMillis(500L), backoff.backoffForRetry(3));
    assertEquals(Duration.ofMillis(500L), backoff.backoffForRetry(40));
  }

  @Test
  void shouldAddAtMostTenPercentJitter() {
    JitteredExponentialBackoff backoff =
        new JitteredExponentialBackoff(
            Duration.ofMillis(1_000L), Duration.ofMillis(60_000L), 0.1d, () -> 1.0d);

    assertEquals(Duration.ofMillis(1_100L), backoff.backoffForRetry(0));
    assertEquals(Duration.ofMillis(66_000L), backoff.backoffForRetry(10));
  }

  @Test
  void shouldStayWithinBoundsAndNeverShrinkBelowPreviousFloor() {
    JitteredExponentialBackoff backoff =
        new JitteredExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60));

    long previousFloor = 0L;
    for (int retry = 0; retry < 12; retry++) {
      long floor = Math.min(1_000L * (1L << retry), 60_000L);
      long actual = backoff.backoffForRetry(retry).toMillis();
      assertTrue(actual >= floor, "retry " + retry + " below floor: " + actual);
      assertTrue(actual <= floor + floor / 10, "retry " + retry + " above ceiling: " + actual);
      assertTrue(floor >= previousFloor);
      previousFloor = floor;
    }
  }

  @Test
  void shouldClampOutOfRangeJitterSamples() {
    JitteredExponentialBackoff backoff =
        new JitteredExponentialBackoff(
            Duration.ofMillis(1_000L),
            Duration.ofMillis(1_000L),
            0.1d,
            () -> ThreadLocalRandom.current().nextBoolean() ? -3.0d : 7.0d);

    long actual = backoff.backoffForRetry(5).toMillis();

    assertTrue(actual == 1_000L || actual == 1_100L);
    assertEquals(Duration.ofMillis(1_000L), backoff.maxBackoff());
  }
}
