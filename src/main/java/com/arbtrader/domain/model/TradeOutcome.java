package com.arbtrader.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/** Realized result of an executed trade, folded into the risk state by {@code recordTrade}. */
@Value
public class TradeOutcome {

    BigDecimal notionalUsd;
    BigDecimal realizedProfitUsd;

    public static TradeOutcome of(BigDecimal notionalUsd, BigDecimal realizedProfitUsd) {
        return new TradeOutcome(notionalUsd, realizedProfitUsd);
    }

    /** Break-even counts as a loss. */
    public boolean isLoss() {
        return realizedProfitUsd.signum() <= 0;
    }
}
