package com.tradefeed.ingest.api;

import com.tradefeed.domain.trades.Pair;
import java.util.List;

public record PairsResponse(int count, List<String> pairs) {
  static PairsResponse from(List<Pair> pairs) {
    List<String> symbols = pairs.stream().map(Pair::symbol).toList();
    return new PairsResponse(symbols.size(), symbols);
  }
}
