package com.tradefeed.domain.trades;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StreamRecord(Map<String, String> fields) {
  public static final String EXCHANGE = "exchange";
  public static final String PAIR = "pair";
  public static final String PRICE = "price";
  public static final String QUANTITY = "quantity";
  public static final String TIMESTAMP = "timestamp";
  public static final String SIDE = "side";
  public static final String TRADE_ID = "trade_id";
  public static final String RAW = "raw";

  public StreamRecord {
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("fields must not be empty");
    }
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static StreamRecord from(NormalizedTrade trade) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(EXCHANGE, trade.exchange());
    fields.put(PAIR, trade.pair().symbol());
    fields.put(PRICE, trade.price());
    fields.put(QUANTITY, trade.quantity());
    fields.put(TIMESTAMP, trade.timestamp().toString());
    fields.put(SIDE, trade.side().wireValue());
    fields.put(TRADE_ID, trade.tradeId());
    fields.put(RAW, trade.rawPayload());
    return new StreamRecord(fields);
  }
}
