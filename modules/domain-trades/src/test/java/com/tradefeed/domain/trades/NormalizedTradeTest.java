package com.tradefeed.domain.trades;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NormalizedTradeTest {
  @Test
  void shouldKeepDecimalStringsVerbatim() {
    NormalizedTrade trade = trade("42100.01000000", "0.00100000", "{}");

    assertEquals("42100.01000000", trade.price());
    assertEquals(new BigDecimal("42100.01"), trade.priceAsDecimal().stripTrailingZeros());
    assertEquals(new BigDecimal("0.00100000"), trade.quantityAsDecimal());
  }

  @Test
  void shouldRejectNonPositiveOrNonDecimalValues() {
    assertThrows(IllegalArgumentException.class, () -> trade("0", "1", "{}"));
    assertThrows(IllegalArgumentException.class, () -> trade("1", "-0.5", "{}"));
    assertThrows(IllegalArgumentException.class, () -> trade("abc", "1", "{}"));
  }

  @Test
  void shouldTruncateRawPayload() {
    String longPayload = "x".repeat(NormalizedTrade.MAX_RAW_PAYLOAD_LENGTH + 100);

    NormalizedTrade trade = trade("1", "1", longPayload);

    assertEquals(NormalizedTrade.MAX_RAW_PAYLOAD_LENGTH, trade.rawPayload().length());
  }

  @Test
  void shouldFlattenIntoStreamRecordInFieldOrder() {
    NormalizedTrade trade = trade("30000.5", "0.25", "{\"e\":\"trade\"}");

    Map<String, String> fields = StreamRecord.from(trade).fields();

    assertEquals(
        List.of("exchange", "pair", "price", "quantity", "timestamp", "side", "trade_id", "raw"),
        List.copyOf(fields.keySet()));
    assertEquals("binance", fields.get(StreamRecord.EXCHANGE));
    assertEquals("BTCUSDT", fields.get(StreamRecord.PAIR));
    assertEquals("2026-03-01T10:15:30Z", fields.get(StreamRecord.TIMESTAMP));
    assertEquals("buy", fields.get(StreamRecord.SIDE));
    assertEquals("12345", fields.get(StreamRecord.TRADE_ID));
  }

  @Test
  void shouldNormalizePairSymbols() {
    assertEquals(new Pair("ETHUSDT"), Pair.of(" ethusdt "));
    assertEquals("ethusdt", Pair.of("ETHUSDT").lowerCase());
    assertThrows(IllegalArgumentException.class, () -> Pair.of("eth-usdt"));
    assertThrows(IllegalArgumentException.class, () -> Pair.of("  "));
  }

  @Test
  void shouldDeriveSideFromBuyerMakerFlag() {
    assertEquals(TradeSide.SELL, TradeSide.fromBuyerMaker(true));
    assertEquals(TradeSide.BUY, TradeSide.fromBuyerMaker(false));
  }

  private static NormalizedTrade trade(String price, String quantity, String raw) {
    return new NormalizedTrade(
        "binance",
        Pair.of("BTCUSDT"),
        price,
        quantity,
        Instant.parse("2026-03-01T10:15:30Z"),
        TradeSide.BUY,
        "12345",
        raw);
  }
}
