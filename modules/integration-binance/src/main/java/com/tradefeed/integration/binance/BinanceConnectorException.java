package com.tradefeed.integration.binance;

/**
 * Failure of a Binance REST call. {@code httpStatus} is -1 when no response was received and
 * {@code binanceCode} is the numeric {@code code} of the error payload when one was returned.
 */
public class BinanceConnectorException extends RuntimeException {
  private static final int TOO_MANY_REQUESTS = 429;
  private static final int IP_BANNED = 418;

  private final int httpStatus;
  private final Integer binanceCode;

  public BinanceConnectorException(String message, int httpStatus, Integer binanceCode) {
    this(message, httpStatus, binanceCode, null);
  }

  public BinanceConnectorException(
      String message, int httpStatus, Integer binanceCode, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
    this.binanceCode = binanceCode;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public Integer binanceCode() {
    return binanceCode;
  }

  /** True for request-weight throttling and for the temporary IP ban that follows it. */
  public boolean isRateLimited() {
    return httpStatus == TOO_MANY_REQUESTS || httpStatus == IP_BANNED;
  }
}
