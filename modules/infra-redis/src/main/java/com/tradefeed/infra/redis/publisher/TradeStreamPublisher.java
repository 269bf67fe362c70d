package com.tradefeed.infra.redis.publisher;

import java.util.Map;

/**
 * Appends flattened trade records to bounded per-pair streams.
 *
 * <p>Implementations never throw from {@link #publish}; a failed append is counted and reported
 * through the return value so a caller's read loop keeps running.
 */
public interface TradeStreamPublisher {
  void connect();

  void disconnect();

  boolean publish(String pair, Map<String, ?> record);

  boolean isHealthy();

  PublisherStats getStats();
}
