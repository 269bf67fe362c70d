package com.tradefeed.infra.redis.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

/**
 * Stream keys are per pair, so they are deliberately left out of the tags to keep series count
 * independent of the working set size.
 */
public class MicrometerStreamTelemetry implements StreamTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerStreamTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String streamKey, long durationNanos) {
    Counter.builder("infra.redis.stream.publish.total")
        .description("Total stream append attempts by outcome")
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.redis.stream.publish.duration")
        .description("Stream append latency")
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String streamKey, Throwable error) {
    Counter.builder("infra.redis.stream.publish.total")
        .description("Total stream append attempts by outcome")
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    Throwable cause = error.getCause() != null ? error.getCause() : error;
    return cause.getClass().getSimpleName();
  }
}
