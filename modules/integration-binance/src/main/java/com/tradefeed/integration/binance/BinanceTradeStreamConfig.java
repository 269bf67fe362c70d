package com.tradefeed.integration.binance;

import com.tradefeed.domain.trades.Pair;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

public record BinanceTradeStreamConfig(
    URI wsBaseUri,
    int pairsPerConnection,
    Duration connectTimeout,
    Duration reconnectBaseBackoff,
    Duration reconnectMaxBackoff,
    int maxRetries) {
  public BinanceTradeStreamConfig {
    if (wsBaseUri == null) {
      throw new IllegalArgumentException("wsBaseUri is required");
    }
    if (pairsPerConnection <= 0) {
      throw new IllegalArgumentException("pairsPerConnection must be > 0");
    }
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be > 0");
    }
    if (reconnectBaseBackoff == null
        || reconnectBaseBackoff.isNegative()
        || reconnectBaseBackoff.isZero()) {
      throw new IllegalArgumentException("reconnectBaseBackoff must be > 0");
    }
    if (reconnectMaxBackoff == null
        || reconnectMaxBackoff.isNegative()
        || reconnectMaxBackoff.isZero()) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be > 0");
    }
    if (reconnectMaxBackoff.compareTo(reconnectBaseBackoff) < 0) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectBaseBackoff");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
  }

  /** Combined-stream URI subscribing every pair to its {@code @trade} channel. */
  public URI combinedStreamUri(List<Pair> pairs) {
    if (pairs == null || pairs.isEmpty()) {
      throw new IllegalArgumentException("pairs must not be empty");
    }
    String base = wsBaseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    String streams =
        pairs.stream().map(pair -> pair.lowerCase() + "@trade").collect(Collectors.joining("/"));
    return URI.create(base + "/stream?streams=" + streams);
  }

  public JitteredExponentialBackoff backoff() {
    return new JitteredExponentialBackoff(reconnectBaseBackoff, reconnectMaxBackoff);
  }
}
