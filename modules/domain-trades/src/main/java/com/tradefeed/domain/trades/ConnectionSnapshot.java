package com.tradefeed.domain.trades;

import java.util.List;

public record ConnectionSnapshot(
    String connectionId,
    List<Pair> pairs,
    ConnectionStatus status,
    int retryCount,
    boolean active,
    long messages,
    long errors) {
  public ConnectionSnapshot {
    pairs = pairs == null ? List.of() : List.copyOf(pairs);
  }
}
