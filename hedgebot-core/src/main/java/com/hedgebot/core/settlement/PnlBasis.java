package com.hedgebot.core.settlement;

public enum PnlBasis {
  /**
   * Computed from verified back and hedge fills.
   */
  CALCULATED,
  /**
   * Market closed with the hedge verified at zero matched; the back stake is counted as lost.
   */
  FULL_LOSS_UNHEDGED,
  /**
   * Inputs were incomplete; no amount is recorded.
   */
  UNKNOWN
}
