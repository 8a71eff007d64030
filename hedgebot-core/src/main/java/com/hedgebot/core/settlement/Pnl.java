package com.hedgebot.core.settlement;

import java.math.BigDecimal;
import java.util.Objects;

public record Pnl(BigDecimal amount, PnlBasis basis) {

  public Pnl {
    Objects.requireNonNull(basis, "basis");
    if (basis == PnlBasis.UNKNOWN && amount != null) {
      throw new IllegalArgumentException("unknown pnl cannot carry an amount");
    }
    if (basis != PnlBasis.UNKNOWN && amount == null) {
      throw new IllegalArgumentException("known pnl requires an amount");
    }
  }

  public static Pnl unknown() {
    return new Pnl(null, PnlBasis.UNKNOWN);
  }

  public boolean isKnown() {
    return basis != PnlBasis.UNKNOWN;
  }
}
