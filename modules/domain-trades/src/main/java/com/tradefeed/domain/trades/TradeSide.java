package com.tradefeed.domain.trades;

import java.util.Locale;

public enum TradeSide {
  BUY,
  SELL;

  /**
   * A maker buyer means the aggressor sold into the bid.
   */
  public static TradeSide fromBuyerMaker(boolean buyerMaker) {
    return buyerMaker ? SELL : BUY;
  }

  public String wireValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
