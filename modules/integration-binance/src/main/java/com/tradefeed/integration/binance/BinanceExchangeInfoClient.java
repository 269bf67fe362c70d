package com.tradefeed.integration.binance;

import java.util.List;

public interface BinanceExchangeInfoClient {
  List<BinanceSymbolInfo> getSymbols();
}
