package com.tradefeed.infra.redis.observability;

public interface StreamTelemetry {
  void onPublishSuccess(String streamKey, long durationNanos);

  void onPublishFailure(String streamKey, Throwable error);
}
