package com.tradefeed.integration.binance;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

public interface BinanceStreamTransport {
  CompletableFuture<StreamSession> open(
      URI uri, Duration connectTimeout, StreamFrameListener listener);
}
