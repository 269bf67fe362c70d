package com.tradefeed.domain.trades;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

public final class PairChunks {
  private PairChunks() {}

  /**
   * Splits pairs into consecutive chunks of at most {@code chunkSize}, keeping input order.
   * Duplicate pairs are dropped before chunking.
   */
  public static List<List<Pair>> partition(List<Pair> pairs, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be > 0");
    }
    if (pairs == null || pairs.isEmpty()) {
      return List.of();
    }
    List<Pair> distinct = new ArrayList<>(new LinkedHashSet<>(pairs));
    List<List<Pair>> chunks = new ArrayList<>();
    for (int start = 0; start < distinct.size(); start += chunkSize) {
      int end = Math.min(distinct.size(), start + chunkSize);
      chunks.add(List.copyOf(distinct.subList(start, end)));
    }
    return List.copyOf(chunks);
  }
}
