package com.arbtrader.profit;

import com.arbtrader.domain.model.ProfitCalculation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * USD profit accounting and size heuristics for arbitrage candidates.
 *
 * <p>The authoritative profit of a simulated candidate is computed in token base units
 * by the orchestrator; this class turns those figures into a USD verdict (margin,
 * break-even) and provides the spread-based sizing rules used for quick screening.
 */
@Component
public class ProfitCalculator {

    private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
    private static final int SCALE = 6;

    /**
     * Net profit after gas and slippage, with margin in bps (0 for a zero-size trade)
     * and the break-even gross profit.
     */
    public ProfitCalculation netProfit(
            BigDecimal grossProfitUsd, BigDecimal gasCostUsd, BigDecimal slippageCostUsd, BigDecimal tradeSizeUsd) {
        BigDecimal netProfitUsd = grossProfitUsd.subtract(gasCostUsd).subtract(slippageCostUsd);
        BigDecimal marginBps = tradeSizeUsd.signum() > 0
                ? netProfitUsd.multiply(BPS).divide(tradeSizeUsd, SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return ProfitCalculation.builder()
                .grossProfitUsd(grossProfitUsd)
                .gasCostUsd(gasCostUsd)
                .slippageCostUsd(slippageCostUsd)
                .netProfitUsd(netProfitUsd)
                .profitMarginBps(marginBps)
                .breakEvenUsd(gasCostUsd.add(slippageCostUsd))
                .build();
    }

    /** Inclusive: a trade netting exactly the minimum is profitable. */
    public boolean isProfitable(ProfitCalculation calculation, BigDecimal minProfitUsd) {
        return calculation.getNetProfitUsd().compareTo(minProfitUsd) >= 0;
    }

    /** Modelled slippage cost: notional * slippageBps / 10000. */
    public BigDecimal slippageCost(BigDecimal notionalUsd, int slippageBps) {
        return notionalUsd.multiply(BigDecimal.valueOf(slippageBps)).divide(BPS, SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Smallest trade size whose spread profit covers gas (break-even) and gas plus
     * {@code minProfitUsd}, capped at {@code maxSizeUsd}. Zero when the spread is not positive.
     */
    public BigDecimal calculateOptimalSize(
            BigDecimal spreadBps, BigDecimal gasCostUsd, BigDecimal maxSizeUsd, BigDecimal minProfitUsd) {
        if (spreadBps.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal minSizeForBreakEven = gasCostUsd.multiply(BPS).divide(spreadBps, SCALE, RoundingMode.HALF_UP);
        BigDecimal minSizeForProfit =
                gasCostUsd.add(minProfitUsd).multiply(BPS).divide(spreadBps, SCALE, RoundingMode.HALF_UP);
        return minSizeForProfit.max(minSizeForBreakEven).min(maxSizeUsd);
    }

    /** Spread profit of a trade minus gas and slippage. */
    public BigDecimal expectedProfit(
            BigDecimal tradeSizeUsd, BigDecimal spreadBps, BigDecimal gasCostUsd, int slippageBps) {
        BigDecimal gross = tradeSizeUsd.multiply(spreadBps).divide(BPS, SCALE, RoundingMode.HALF_UP);
        return gross.subtract(gasCostUsd).subtract(slippageCost(tradeSizeUsd, slippageBps));
    }

    /**
     * Upper size bound for a spread: ten times the size at which the spread net of
     * slippage pays for gas, capped at {@code maxSizeUsd}. Zero when slippage eats the spread.
     */
    public BigDecimal maxProfitableSize(
            BigDecimal spreadBps, BigDecimal gasCostUsd, int slippageBps, BigDecimal maxSizeUsd) {
        BigDecimal netSpreadBps = spreadBps.subtract(BigDecimal.valueOf(slippageBps));
        if (netSpreadBps.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal size = gasCostUsd
                .multiply(BPS)
                .divide(netSpreadBps, SCALE, RoundingMode.HALF_UP)
                .multiply(BigDecimal.TEN);
        return size.min(maxSizeUsd);
    }

    /** Gas may take at most {@code maxGasRatio} of the expected profit; never acceptable for a non-positive profit. */
    public boolean isGasCostAcceptable(BigDecimal gasCostUsd, BigDecimal expectedProfitUsd, BigDecimal maxGasRatio) {
        if (expectedProfitUsd.signum() <= 0) {
            return false;
        }
        BigDecimal ratio = gasCostUsd.divide(expectedProfitUsd, SCALE, RoundingMode.HALF_UP);
        return ratio.compareTo(maxGasRatio) <= 0;
    }
}
