package com.tradefeed.domain.trades;

import java.util.Locale;
import java.util.regex.Pattern;

public record Pair(String symbol) implements Comparable<Pair> {
  private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9]{2,32}$");

  public Pair {
    if (symbol == null || !SYMBOL_PATTERN.matcher(symbol).matches()) {
      throw new IllegalArgumentException("Invalid pair symbol: " + symbol);
    }
  }

  public static Pair of(String rawSymbol) {
    if (rawSymbol == null) {
      throw new IllegalArgumentException("Invalid pair symbol: null");
    }
    return new Pair(rawSymbol.trim().toUpperCase(Locale.ROOT));
  }

  public String lowerCase() {
    return symbol.toLowerCase(Locale.ROOT);
  }

  @Override
  public int compareTo(Pair other) {
    return symbol.compareTo(other.symbol);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
