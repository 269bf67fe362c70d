package com.tradefeed.infra.redis.observability;

public class NoOpStreamTelemetry implements StreamTelemetry {
  @Override
  public void onPublishSuccess(String streamKey, long durationNanos) {}

  @Override
  public void onPublishFailure(String streamKey, Throwable error) {}
}
