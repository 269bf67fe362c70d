package com.tradefeed.integration.coingecko;

import java.util.Optional;

public class CoinGeckoClientException extends RuntimeException {
  public static final int RATE_LIMITED_STATUS = 429;

  private final int httpStatus;
  private final String retryAfterHeader;

  public CoinGeckoClientException(String message, int httpStatus, String retryAfterHeader) {
    super(message);
    this.httpStatus = httpStatus;
    this.retryAfterHeader = retryAfterHeader;
  }

  public CoinGeckoClientException(String message, int httpStatus, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
    this.retryAfterHeader = null;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public Optional<String> retryAfterHeader() {
    return Optional.ofNullable(retryAfterHeader);
  }

  public boolean isRateLimited() {
    return httpStatus == RATE_LIMITED_STATUS;
  }
}
