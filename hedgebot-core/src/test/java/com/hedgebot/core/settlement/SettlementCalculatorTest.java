package com.hedgebot.core.settlement;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettlementCalculatorTest {

  private static final double COMMISSION = 0.0175;

  @Test
  void greenUpAtTheProfitTargetTakesTheWorseOutcomeNetOfCommission() {
    HedgeQuote quote = SettlementCalculator.quoteLay(200, 2.0, 1.82, COMMISSION);
    assertThat(quote.layStake()).isEqualTo(219.78);

    Pnl pnl = SettlementCalculator.settle(200.0, 2.0, quote.layStake(), 1.82, COMMISSION);

    // min(200*1 - 219.78*0.82, 219.78 - 200) = 19.78, less 1.75%
    assertThat(pnl.basis()).isEqualTo(PnlBasis.CALCULATED);
    assertThat(pnl.amount()).isEqualByComparingTo("19.43");
  }

  @Test
  void lossesCarryNoCommission() {
    Pnl pnl = SettlementCalculator.settle(200.0, 2.0, 100.0, 2.5, COMMISSION);

    assertThat(pnl.amount()).isEqualByComparingTo("-100.00");
  }

  @Test
  void missingInputsGiveUnknownRatherThanZero() {
    assertThat(SettlementCalculator.settle(200.0, 2.0, null, null, COMMISSION)).isEqualTo(Pnl.unknown());
    assertThat(SettlementCalculator.settle(200.0, 2.0, 0.0, 1.9, COMMISSION).isKnown()).isFalse();
    assertThat(SettlementCalculator.settle(null, 2.0, 100.0, 1.9, COMMISSION).amount()).isNull();
  }

  @Test
  void settlingTwiceGivesTheSameResult() {
    Pnl first = SettlementCalculator.settle(150.0, 3.1, 170.0, 2.7, COMMISSION);
    Pnl second = SettlementCalculator.settle(150.0, 3.1, 170.0, 2.7, COMMISSION);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void verifiedUnhedgedPositionLosesTheWholeStake() {
    Pnl pnl = SettlementCalculator.settleVerifiedUnhedged(200);

    assertThat(pnl.basis()).isEqualTo(PnlBasis.FULL_LOSS_UNHEDGED);
    assertThat(pnl.amount()).isEqualByComparingTo(BigDecimal.valueOf(-200));
    assertThatThrownBy(() -> SettlementCalculator.settleVerifiedUnhedged(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void aggregatesPartialFillsBySize() {
    Fill fill = SettlementCalculator.aggregate(List.of(new Fill(10, 2.0), new Fill(5, 2.2), Fill.NONE));

    assertThat(fill.size()).isEqualTo(15.0);
    assertThat(fill.price()).isEqualTo(2.067);
    assertThat(SettlementCalculator.aggregate(List.of())).isEqualTo(Fill.NONE);
  }

  @Test
  void unhedgedStakeShrinksWithLaidSize() {
    assertThat(SettlementCalculator.unhedgedBackStake(200, 2.0, Fill.NONE)).isEqualTo(200.0);
    assertThat(SettlementCalculator.unhedgedBackStake(200, 2.0, new Fill(100, 2.0))).isEqualTo(100.0);
    assertThat(SettlementCalculator.unhedgedBackStake(200, 2.0, new Fill(300, 2.0))).isZero();
  }

  @Test
  void rejectsCommissionOutsideRange() {
    assertThatThrownBy(() -> SettlementCalculator.settle(200.0, 2.0, 219.78, 1.82, 1.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void unknownPnlCannotCarryAnAmount() {
    assertThatThrownBy(() -> new Pnl(BigDecimal.ONE, PnlBasis.UNKNOWN))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
