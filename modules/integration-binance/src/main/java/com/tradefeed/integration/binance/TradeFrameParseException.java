package com.tradefeed.integration.binance;

public class TradeFrameParseException extends RuntimeException {
  public TradeFrameParseException(String message) {
    super(message);
  }

  public TradeFrameParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
