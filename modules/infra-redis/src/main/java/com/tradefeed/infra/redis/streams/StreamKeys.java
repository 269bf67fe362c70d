package com.tradefeed.infra.redis.streams;

import java.util.Locale;
import java.util.regex.Pattern;

/** Builds the per-pair stream key, {@code <prefix>:<PAIR>}. */
public final class StreamKeys {
  private static final Pattern PREFIX_PATTERN = Pattern.compile("^[a-z][a-z0-9_.-]*$");
  private static final Pattern PAIR_PATTERN = Pattern.compile("^[A-Z0-9]{2,32}$");

  private final String prefix;

  public StreamKeys(String prefix) {
    if (prefix == null || !PREFIX_PATTERN.matcher(prefix).matches()) {
      throw new IllegalArgumentException("Invalid stream key prefix: " + prefix);
    }
    this.prefix = prefix;
  }

  public String forPair(String pair) {
    if (pair == null) {
      throw new IllegalArgumentException("Invalid pair for stream key: null");
    }
    String normalized = pair.trim().toUpperCase(Locale.ROOT);
    if (!PAIR_PATTERN.matcher(normalized).matches()) {
      throw new IllegalArgumentException("Invalid pair for stream key: " + pair);
    }
    return prefix + ":" + normalized;
  }

  public String prefix() {
    return prefix;
  }
}
