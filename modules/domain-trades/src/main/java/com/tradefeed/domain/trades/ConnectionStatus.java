package com.tradefeed.domain.trades;

public enum ConnectionStatus {
  CONNECTING,
  STREAMING,
  BACKOFF,
  FAILED,
  STOPPED;

  public boolean isTerminal() {
    return this == FAILED || this == STOPPED;
  }
}
