package com.tradefeed.integration.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradefeed.domain.trades.NormalizedTrade;
import com.tradefeed.domain.trades.Pair;
import com.tradefeed.domain.trades.TradeSide;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a raw {@code @trade} frame into a {@link NormalizedTrade}.
 *
 * <p>Combined-stream envelopes ({@code {"stream": ..., "data": {...}}}) are unwrapped first. Frames
 * for other event types yield an empty result; frames claiming to be trades but failing validation
 * raise {@link TradeFrameParseException}. The clock only supplies a timestamp when {@code T} is
 * absent.
 */
public class BinanceTradeFrameParser {
  public static final String EXCHANGE = "binance";
  private static final String TRADE_EVENT = "trade";

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public BinanceTradeFrameParser(ObjectMapper objectMapper, Clock clock) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.clock = Objects.requireNonNull(clock, "clock is required");
  }

  public Optional<NormalizedTrade> parse(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new TradeFrameParseException("Empty trade frame");
    }
    JsonNode root = readTree(payload);
    JsonNode event = root.path("data").isObject() ? root.get("data") : root;
    if (!TRADE_EVENT.equals(event.path("e").asText(""))) {
      return Optional.empty();
    }

    String symbol = requiredText(event, "s");
    String price = requiredText(event, "p");
    String quantity = requiredText(event, "q");
    String tradeId = requiredText(event, "t");
    JsonNode buyerMaker = event.get("m");
    if (buyerMaker == null || !buyerMaker.isBoolean()) {
      throw new TradeFrameParseException("Trade frame missing boolean field: m");
    }
    Instant timestamp = tradeTime(event);

    try {
      return Optional.of(
          new NormalizedTrade(
              EXCHANGE,
              Pair.of(symbol),
              price,
              quantity,
              timestamp,
              TradeSide.fromBuyerMaker(buyerMaker.booleanValue()),
              tradeId,
              payload));
    } catch (IllegalArgumentException ex) {
      throw new TradeFrameParseException("Invalid trade frame: " + ex.getMessage(), ex);
    }
  }

  private JsonNode readTree(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (IOException ex) {
      throw new TradeFrameParseException("Trade frame is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new TradeFrameParseException("Trade frame is not a JSON object");
    }
    return root;
  }

  private Instant tradeTime(JsonNode event) {
    JsonNode tradeTime = event.get("T");
    if (tradeTime == null || tradeTime.isNull()) {
      return Instant.now(clock);
    }
    if (!tradeTime.canConvertToLong() || tradeTime.asLong() <= 0L) {
      throw new TradeFrameParseException("Trade frame has invalid trade time: " + tradeTime);
    }
    return Instant.ofEpochMilli(tradeTime.asLong());
  }

  private static String requiredText(JsonNode event, String field) {
    JsonNode node = event.get(field);
    if (node == null || node.isNull() || node.isContainerNode()) {
      throw new TradeFrameParseException("Trade frame missing field: " + field);
    }
    String value = node.asText("");
    if (value.isBlank()) {
      throw new TradeFrameParseException("Trade frame has blank field: " + field);
    }
    return value;
  }
}
