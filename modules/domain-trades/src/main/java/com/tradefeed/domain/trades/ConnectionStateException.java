package com.tradefeed.domain.trades;

public class ConnectionStateException extends RuntimeException {
  public ConnectionStateException(String message) {
    super(message);
  }
}
