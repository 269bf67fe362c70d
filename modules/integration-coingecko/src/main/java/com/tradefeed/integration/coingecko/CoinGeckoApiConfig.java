package com.tradefeed.integration.coingecko;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

public record CoinGeckoApiConfig(
    URI baseUri,
    String apiKey,
    Duration timeout,
    int maxAttempts,
    Duration retryBaseBackoff,
    Duration retryMaxBackoff) {
  public CoinGeckoApiConfig {
    if (baseUri == null) {
      throw new IllegalArgumentException("baseUri is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (retryBaseBackoff == null || retryBaseBackoff.isNegative()) {
      throw new IllegalArgumentException("retryBaseBackoff must be >= 0");
    }
    if (retryMaxBackoff == null || retryMaxBackoff.compareTo(retryBaseBackoff) < 0) {
      throw new IllegalArgumentException("retryMaxBackoff must be >= retryBaseBackoff");
    }
    apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
  }

  public Optional<String> proApiKey() {
    return Optional.ofNullable(apiKey);
  }
}
