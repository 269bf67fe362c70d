package com.tradefeed.integration.binance;

public enum FrameOutcome {
  PUBLISHED,
  PUBLISH_FAILED,
  IGNORED,
  MALFORMED;

  public boolean isTrade() {
    return this == PUBLISHED || this == PUBLISH_FAILED;
  }
}
