package com.arbtrader.risk.analytics;

import com.arbtrader.risk.RiskLimits;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Derives adjusted {@link RiskLimits} from market and performance conditions.
 *
 * <p>Every method is pure: it returns a new limits object and never touches its input.
 * A scaled trade rate is floored and kept at one or more, so results always validate.
 * <ul>
 *   <li><b>Volatility</b> (score 0-1): {@code m = 1 - 0.5 * score} shrinks amounts,
 *       rate and loss streak (never below 2); cooldown grows by {@code (1 + score)},
 *       spacing by {@code (1 + 2 * score)}</li>
 *   <li><b>Performance</b>: {@code m = clamp(winRate * 2, 0.5, 1.5) * (pnl > 0 ? 1.1 : 0.9)}
 *       scales amounts and rate; cooldown and spacing are divided by m</li>
 *   <li><b>Time of day</b>: the {@link LiquidityWindows} multiplier scales notional and
 *       rate and divides the cooldown</li>
 * </ul>
 */
@Component
public class RiskLimitAdjuster {

    private static final int SCALE = 6;

    private final LiquidityWindows liquidityWindows;

    public RiskLimitAdjuster(LiquidityWindows liquidityWindows) {
        this.liquidityWindows = liquidityWindows;
    }

    public RiskLimits adjustForVolatility(RiskLimits base, double volatilityScore) {
        double score = Math.max(0.0, Math.min(1.0, volatilityScore));
        double m = 1.0 - score * 0.5;

        return RiskLimits.builder()
                .maxDailyLossUsd(scale(base.getMaxDailyLossUsd(), m))
                .maxNotionalUsd(scale(base.getMaxNotionalUsd(), m))
                .maxTradesPerHour(scaleTradeRate(base.getMaxTradesPerHour(), m))
                .maxConsecutiveLosses(Math.max(2, (int) Math.floor(base.getMaxConsecutiveLosses() * m)))
                .cooldownAfterLossMs(Math.round(base.getCooldownAfterLossMs() * (1.0 + score)))
                .minTimeBetweenTradesMs(Math.round(base.getMinTimeBetweenTradesMs() * (1.0 + score * 2.0)))
                .build();
    }

    public RiskLimits adjustForPerformance(RiskLimits base, double recentWinRate, BigDecimal recentPnl) {
        double performanceMultiplier = Math.max(0.5, Math.min(1.5, recentWinRate * 2.0));
        double pnlAdjustment = recentPnl.signum() > 0 ? 1.1 : 0.9;
        double m = performanceMultiplier * pnlAdjustment;

        return RiskLimits.builder()
                .maxDailyLossUsd(scale(base.getMaxDailyLossUsd(), m))
                .maxNotionalUsd(scale(base.getMaxNotionalUsd(), m))
                .maxTradesPerHour(scaleTradeRate(base.getMaxTradesPerHour(), m))
                .maxConsecutiveLosses(base.getMaxConsecutiveLosses())
                .cooldownAfterLossMs(Math.round(base.getCooldownAfterLossMs() / m))
                .minTimeBetweenTradesMs(Math.round(base.getMinTimeBetweenTradesMs() / m))
                .build();
    }

    /** @param hour hour of day, 0-23 */
    public RiskLimits adjustForTimeOfDay(RiskLimits base, int hour) {
        double m = liquidityWindows.multiplierFor(hour);

        return RiskLimits.builder()
                .maxDailyLossUsd(base.getMaxDailyLossUsd())
                .maxNotionalUsd(scale(base.getMaxNotionalUsd(), m))
                .maxTradesPerHour(scaleTradeRate(base.getMaxTradesPerHour(), m))
                .maxConsecutiveLosses(base.getMaxConsecutiveLosses())
                .cooldownAfterLossMs(Math.round(base.getCooldownAfterLossMs() / m))
                .minTimeBetweenTradesMs(base.getMinTimeBetweenTradesMs())
                .build();
    }

    /** Floor of the scaled rate, never below one trade per hour. */
    private static int scaleTradeRate(int tradesPerHour, double multiplier) {
        return Math.max(1, (int) Math.floor(tradesPerHour * multiplier));
    }

    private static BigDecimal scale(BigDecimal amount, double multiplier) {
        return amount.multiply(BigDecimal.valueOf(multiplier)).setScale(SCALE, RoundingMode.HALF_UP);
    }
}
