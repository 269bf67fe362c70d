package com.tradefeed.integration.coingecko;

public record RankedCoin(String id, String symbol, int marketCapRank) {}
