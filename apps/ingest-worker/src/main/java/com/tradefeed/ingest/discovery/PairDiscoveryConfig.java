package com.tradefeed.ingest.discovery;

import com.tradefeed.domain.trades.Pair;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record PairDiscoveryConfig(
    int pairLimit,
    int rankingSize,
    Set<String> quoteAssets,
    Set<String> excludedBaseAssets,
    List<Pair> fallbackPairs) {
  public PairDiscoveryConfig {
    if (pairLimit <= 0) {
      throw new IllegalArgumentException("pairLimit must be > 0");
    }
    if (rankingSize <= 0) {
      throw new IllegalArgumentException("rankingSize must be > 0");
    }
    quoteAssets = normalizeAssets(quoteAssets);
    if (quoteAssets.isEmpty()) {
      throw new IllegalArgumentException("quoteAssets must not be empty");
    }
    excludedBaseAssets = normalizeAssets(excludedBaseAssets);
    fallbackPairs =
        fallbackPairs == null ? List.of() : List.copyOf(new LinkedHashSet<>(fallbackPairs));
    if (fallbackPairs.isEmpty()) {
      throw new IllegalArgumentException("fallbackPairs must not be empty");
    }
  }

  /** Parses a list of raw symbols, skipping blanks; an invalid symbol fails the whole list. */
  public static List<Pair> parsePairs(List<String> rawSymbols) {
    if (rawSymbols == null) {
      return List.of();
    }
    return rawSymbols.stream()
        .filter(symbol -> symbol != null && !symbol.isBlank())
        .map(Pair::of)
        .distinct()
        .toList();
  }

  private static Set<String> normalizeAssets(Set<String> assets) {
    if (assets == null) {
      return Set.of();
    }
    return assets.stream()
        .filter(asset -> asset != null && !asset.isBlank())
        .map(asset -> asset.trim().toUpperCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
