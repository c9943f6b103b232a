package com.arbtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** USD view of a simulated trade's profitability. */
@Value
@Builder
public class ProfitCalculation {

    BigDecimal grossProfitUsd;
    BigDecimal gasCostUsd;
    BigDecimal slippageCostUsd;
    BigDecimal netProfitUsd;

    /** Net profit relative to trade size, in basis points. Zero for a zero-size trade. */
    BigDecimal profitMarginBps;

    /** Gross profit needed to cover gas and slippage. */
    BigDecimal breakEvenUsd;
}
