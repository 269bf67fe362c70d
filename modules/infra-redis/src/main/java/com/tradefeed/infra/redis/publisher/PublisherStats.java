package com.tradefeed.infra.redis.publisher;

public record PublisherStats(long publishCount, long errorCount, double errorRate) {
  public static PublisherStats of(long publishCount, long errorCount) {
    long attempts = publishCount + errorCount;
    double errorRate = attempts == 0L ? 0.0d : (double) errorCount / attempts;
    return new PublisherStats(publishCount, errorCount, errorRate);
  }
}
