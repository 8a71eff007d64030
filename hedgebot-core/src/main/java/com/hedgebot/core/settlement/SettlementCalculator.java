package com.hedgebot.core.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Profit/loss arithmetic for a back position and its lay hedge.
 *
 * Commission applies only to a net win. All money values are rounded half-up to pence.
 */
public final class SettlementCalculator {

  private static final int MONEY_SCALE = 2;
  private static final int AVERAGE_PRICE_SCALE = 3;

  private SettlementCalculator() {
  }

  /**
   * Realised PnL of a settled position, taking the worse of the two outcomes.
   *
   * @return {@link Pnl#unknown()} when the back side is missing or the hedge is missing/zero
   */
  public static Pnl settle(Double backStake, Double backPrice, Double layStake, Double layPrice, double commission) {
    if (!positive(backStake) || !positive(backPrice)) {
      return Pnl.unknown();
    }
    if (!positive(layStake) || !positive(layPrice)) {
      return Pnl.unknown();
    }
    BigDecimal bs = BigDecimal.valueOf(backStake);
    BigDecimal bp = BigDecimal.valueOf(backPrice);
    BigDecimal ls = BigDecimal.valueOf(layStake);
    BigDecimal lp = BigDecimal.valueOf(layPrice);

    BigDecimal profitIfWins = bs.multiply(bp.subtract(BigDecimal.ONE))
        .subtract(ls.multiply(lp.subtract(BigDecimal.ONE)));
    BigDecimal profitIfLoses = ls.subtract(bs);
    BigDecimal gross = profitIfWins.min(profitIfLoses);
    BigDecimal net = gross.signum() >= 0 ? gross.multiply(keepRate(commission)) : gross;
    return new Pnl(net.setScale(MONEY_SCALE, RoundingMode.HALF_UP), PnlBasis.CALCULATED);
  }

  /**
   * PnL of a position whose market closed while the hedge was verified at exactly zero matched.
   */
  public static Pnl settleVerifiedUnhedged(double backStake) {
    if (backStake <= 0) {
      throw new IllegalArgumentException("backStake must be positive: " + backStake);
    }
    return new Pnl(BigDecimal.valueOf(backStake).negate().setScale(MONEY_SCALE, RoundingMode.HALF_UP),
        PnlBasis.FULL_LOSS_UNHEDGED);
  }

  /**
   * Lay stake for an equal-exposure hedge: {@code backStake * backPrice / layPrice}.
   */
  public static HedgeQuote quoteLay(double backStake, double backPrice, double layPrice, double commission) {
    if (backStake <= 0 || backPrice <= 1.0 || layPrice <= 1.0) {
      throw new IllegalArgumentException("invalid hedge inputs: stake=%s back=%s lay=%s"
          .formatted(backStake, backPrice, layPrice));
    }
    BigDecimal bs = BigDecimal.valueOf(backStake);
    BigDecimal bp = BigDecimal.valueOf(backPrice);
    BigDecimal lp = BigDecimal.valueOf(layPrice);
    BigDecimal ls = bs.multiply(bp).divide(lp, MONEY_SCALE, RoundingMode.HALF_UP);
    BigDecimal keep = keepRate(commission);

    BigDecimal ifBackWins = bs.multiply(bp.subtract(BigDecimal.ONE))
        .subtract(ls.multiply(lp.subtract(BigDecimal.ONE)))
        .multiply(keep)
        .setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    BigDecimal ifLayWins = ls.subtract(bs).multiply(keep).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    return new HedgeQuote(ls.doubleValue(), ifBackWins, ifLayWins);
  }

  /**
   * Back stake still unhedged after {@code hedged} has been laid against a back matched at {@code backPrice}.
   */
  public static double unhedgedBackStake(double backStake, double backPrice, Fill hedged) {
    if (hedged == null || hedged.isEmpty() || backPrice <= 0) {
      return backStake;
    }
    BigDecimal covered = BigDecimal.valueOf(hedged.size())
        .multiply(BigDecimal.valueOf(hedged.price()))
        .divide(BigDecimal.valueOf(backPrice), MONEY_SCALE, RoundingMode.HALF_UP);
    BigDecimal remaining = BigDecimal.valueOf(backStake).subtract(covered);
    return Math.max(0.0, remaining.setScale(MONEY_SCALE, RoundingMode.HALF_UP).doubleValue());
  }

  /**
   * Size-weighted average of partial fills. Empty fills are ignored.
   */
  public static Fill aggregate(List<Fill> fills) {
    if (fills == null || fills.isEmpty()) {
      return Fill.NONE;
    }
    BigDecimal size = BigDecimal.ZERO;
    BigDecimal notional = BigDecimal.ZERO;
    for (Fill fill : fills) {
      if (fill == null || fill.isEmpty()) {
        continue;
      }
      BigDecimal s = BigDecimal.valueOf(fill.size());
      size = size.add(s);
      notional = notional.add(s.multiply(BigDecimal.valueOf(fill.price())));
    }
    if (size.signum() == 0) {
      return Fill.NONE;
    }
    BigDecimal price = notional.divide(size, AVERAGE_PRICE_SCALE, RoundingMode.HALF_UP);
    return new Fill(size.setScale(MONEY_SCALE, RoundingMode.HALF_UP).doubleValue(), price.doubleValue());
  }

  private static BigDecimal keepRate(double commission) {
    if (commission < 0 || commission >= 1) {
      throw new IllegalArgumentException("commission must be in [0, 1): " + commission);
    }
    return BigDecimal.ONE.subtract(BigDecimal.valueOf(commission));
  }

  private static boolean positive(Double value) {
    return value != null && !value.isNaN() && value > 0;
  }
}
