package com.tradefeed.integration.binance;

public interface StreamSession {
  /** Asks the transport for the next frame; no frame is delivered until this is called. */
  void requestNext();

  /** Sends a normal closure and releases the session. */
  void close();
}
