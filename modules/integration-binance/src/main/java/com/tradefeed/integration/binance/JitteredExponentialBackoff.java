package com.tradefeed.integration.binance;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Reconnect delay of {@code min(base * 2^retryCount, max)} plus a uniform jitter of up to {@code
 * jitterRatio} of that delay.
 */
public class JitteredExponentialBackoff {
  public static final double DEFAULT_JITTER_RATIO = 0.1d;

  private final long baseBackoffMs;
  private final long maxBackoffMs;
  private final double jitterRatio;
  private final DoubleSupplier jitterSource;

  public JitteredExponentialBackoff(Duration baseBackoff, Duration maxBackoff) {
    this(
        baseBackoff,
        maxBackoff,
        DEFAULT_JITTER_RATIO,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public JitteredExponentialBackoff(
      Duration baseBackoff, Duration maxBackoff, double jitterRatio, DoubleSupplier jitterSource) {
    Objects.requireNonNull(baseBackoff, "baseBackoff must not be null");
    Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    if (jitterRatio < 0.0d) {
      throw new IllegalArgumentException("jitterRatio must be >= 0");
    }
    this.baseBackoffMs = Math.max(0L, baseBackoff.toMillis());
    this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoff.toMillis());
    this.jitterRatio = jitterRatio;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  public Duration backoffForRetry(int retryCount) {
    long deterministic = deterministicBackoff(retryCount);
    if (jitterRatio == 0.0d || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    double factor = Math.max(0.0d, Math.min(1.0d, jitterSource.getAsDouble()));
    long jitter = (long) Math.floor(factor * jitterRatio * deterministic);
    return Duration.ofMillis(deterministic + jitter);
  }

  public Duration maxBackoff() {
    return Duration.ofMillis(maxBackoffMs);
  }

  long deterministicBackoff(int retryCount) {
    if (baseBackoffMs == 0L) {
      return 0L;
    }
    int exponent = Math.max(0, retryCount);
    double scaled = baseBackoffMs * Math.pow(2.0d, exponent);
    return (long) Math.floor(Math.min((double) maxBackoffMs, scaled));
  }
}
