package com.tradefeed.integration.coingecko;

import java.util.List;

public interface CoinGeckoRankingClient {
  /** Coins ordered by ascending market-cap rank; coins without a rank are left out. */
  List<RankedCoin> getTopByMarketCap(int limit);
}
