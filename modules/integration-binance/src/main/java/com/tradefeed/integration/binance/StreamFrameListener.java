package com.tradefeed.integration.binance;

/** Callbacks from an open stream session. Calls for one session never overlap. */
public interface StreamFrameListener {
  void onFrame(String payload);

  void onClosed(int statusCode, String reason);

  void onError(Throwable error);
}
