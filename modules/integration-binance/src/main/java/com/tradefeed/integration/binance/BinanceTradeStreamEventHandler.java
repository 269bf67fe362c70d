package com.tradefeed.integration.binance;

import com.tradefeed.domain.trades.Pair;
import java.time.Duration;
import java.util.List;

public interface BinanceTradeStreamEventHandler {
  default void onConnected(String connectionId, List<Pair> pairs) {}

  default void onDisconnected(String connectionId, int statusCode, String reason) {}

  default void onConnectionError(
      String connectionId, String errorCode, String errorMessage, Throwable error) {}

  default void onReconnectScheduled(String connectionId, int retryCount, Duration delay) {}

  default void onFailed(String connectionId, int retryCount) {}

  default FrameOutcome onFrame(String connectionId, String payload) {
    return FrameOutcome.IGNORED;
  }

  static BinanceTradeStreamEventHandler noop() {
    return new BinanceTradeStreamEventHandler() {};
  }
}
