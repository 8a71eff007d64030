package com.hedgebot.core.venue;

/**
 * What the venue does with the unmatched part of an order when the market turns in-play.
 */
public enum PersistenceType {
  /**
   * Cancel the unmatched remainder.
   */
  LAPSE,
  /**
   * Keep the unmatched remainder resting in-play.
   */
  PERSIST,
  /**
   * Convert the remainder to a market-on-close order.
   */
  MARKET_ON_CLOSE
}
