package com.tradefeed.domain.trades;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Exchange-neutral view of a single trade execution.
 *
 * <p>Price and quantity stay in their wire decimal form so no precision is lost between the feed
 * and the stream.
 */
public record NormalizedTrade(
    String exchange,
    Pair pair,
    String price,
    String quantity,
    Instant timestamp,
    TradeSide side,
    String tradeId,
    String rawPayload) {
  public static final int MAX_RAW_PAYLOAD_LENGTH = 512;

  public NormalizedTrade {
    if (exchange == null || exchange.isBlank()) {
      throw new IllegalArgumentException("exchange is required");
    }
    if (pair == null) {
      throw new IllegalArgumentException("pair is required");
    }
    requirePositiveDecimal("price", price);
    requirePositiveDecimal("quantity", quantity);
    if (timestamp == null) {
      throw new IllegalArgumentException("timestamp is required");
    }
    if (side == null) {
      throw new IllegalArgumentException("side is required");
    }
    if (tradeId == null || tradeId.isBlank()) {
      throw new IllegalArgumentException("tradeId is required");
    }
    rawPayload = truncate(rawPayload);
  }

  public BigDecimal priceAsDecimal() {
    return new BigDecimal(price);
  }

  public BigDecimal quantityAsDecimal() {
    return new BigDecimal(quantity);
  }

  private static void requirePositiveDecimal(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(field + " is required");
    }
    BigDecimal parsed;
    try {
      parsed = new BigDecimal(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(field + " is not a decimal: " + value, ex);
    }
    if (parsed.signum() <= 0) {
      throw new IllegalArgumentException(field + " must be > 0: " + value);
    }
  }

  private static String truncate(String value) {
    if (value == null) {
      return "";
    }
    if (value.length() <= MAX_RAW_PAYLOAD_LENGTH) {
      return value;
    }
    return value.substring(0, MAX_RAW_PAYLOAD_LENGTH);
  }
}
