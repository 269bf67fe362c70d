package com.tradefeed.integration.binance;

import java.net.URI;
import java.time.Duration;

public record BinanceApiConfig(URI baseUri, Duration timeout) {
  public BinanceApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
  }
}
