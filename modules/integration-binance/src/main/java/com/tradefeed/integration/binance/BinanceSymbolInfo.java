package com.tradefeed.integration.binance;

public record BinanceSymbolInfo(String symbol, String status, String baseAsset, String quoteAsset) {
  public static final String TRADING = "TRADING";

  public boolean isTrading() {
    return TRADING.equals(status);
  }
}
