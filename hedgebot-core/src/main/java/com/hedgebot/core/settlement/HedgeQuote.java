package com.hedgebot.core.settlement;

import java.math.BigDecimal;

/**
 * Lay stake that greens up a back position, with the commission-adjusted result on each outcome.
 */
public record HedgeQuote(
    double layStake,
    BigDecimal profitIfBackWins,
    BigDecimal profitIfLayWins
) {}
