package com.arbtrader.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of simulating one route at one notional size.
 *
 * <p>All profit fields are in base units of the route's start token, the same precision
 * as the leg-by-leg simulation: {@code netProfit = grossProfit - gasCost - slippageCost}.
 * {@code netProfitUsd} is derived from {@code netProfit} for thresholds and the risk gate.
 */
@Value
@Builder(toBuilder = true)
public class TradeCandidate {

    Route route;
    BigDecimal notionalUsd;
    BigInteger amountIn;
    List<BigInteger> perLegAmountOut;
    BigInteger grossProfit;
    BigInteger gasCost;
    BigInteger slippageCost;
    BigInteger netProfit;
    BigDecimal netProfitUsd;
    GasEstimate gasEstimate;

    /** Confidence score in [0, 1]; NaN until the candidate has been scored. */
    @Builder.Default
    double confidenceScore = Double.NaN;

    public BigInteger getFinalAmountOut() {
        return perLegAmountOut.get(perLegAmountOut.size() - 1);
    }
}
