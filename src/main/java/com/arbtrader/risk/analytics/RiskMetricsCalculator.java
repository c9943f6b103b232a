package com.arbtrader.risk.analytics;

import com.arbtrader.domain.model.PerformanceMetrics;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

/**
 * Risk-adjusted return statistics over a series of per-trade returns.
 *
 * <p>Conventions:
 * <ul>
 *   <li>Sharpe uses the population standard deviation; 0 for fewer than two returns or
 *       a flat series</li>
 *   <li>Sortino divides by the root mean square of the negative returns only;
 *       {@code +Infinity} when there are none</li>
 *   <li>VaR is the historical quantile: the ascending-sorted sample at
 *       {@code floor((1 - confidence) * n)}</li>
 * </ul>
 */
@Component
public class RiskMetricsCalculator {

    public double sharpeRatio(double[] returns, double riskFreeRate) {
        if (returns.length < 2) {
            return 0.0;
        }
        double mean = StatUtils.mean(returns);
        double stdDev = Math.sqrt(StatUtils.populationVariance(returns, mean));
        if (stdDev == 0.0) {
            return 0.0;
        }
        return (mean - riskFreeRate) / stdDev;
    }

    public double sortinoRatio(double[] returns, double riskFreeRate) {
        if (returns.length < 2) {
            return 0.0;
        }
        double mean = StatUtils.mean(returns);
        double[] downside = Arrays.stream(returns).filter(r -> r < 0).toArray();
        if (downside.length == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double downsideDeviation = Math.sqrt(StatUtils.sumSq(downside) / downside.length);
        return (mean - riskFreeRate) / downsideDeviation;
    }

    public double valueAtRisk(double[] returns, double confidenceLevel) {
        if (returns.length == 0) {
            return 0.0;
        }
        double[] sorted = returns.clone();
        Arrays.sort(sorted);
        int index = (int) Math.floor((1.0 - confidenceLevel) * sorted.length);
        return sorted[Math.min(index, sorted.length - 1)];
    }

    /** Largest peak-to-trough decline of an equity curve as a fraction of the peak. */
    public double maxDrawdown(double[] equityCurve) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0.0;
        for (double value : equityCurve) {
            if (value > peak) {
                peak = value;
            } else if (peak > 0.0) {
                maxDrawdown = Math.max(maxDrawdown, (peak - value) / peak);
            }
        }
        return maxDrawdown;
    }

    /** {@code sum(size * risk) / capital}; 0 for non-positive capital. */
    public double portfolioHeat(List<PositionRisk> positions, double totalCapital) {
        if (totalCapital <= 0.0) {
            return 0.0;
        }
        double totalRisk = positions.stream()
                .mapToDouble(p -> p.getSize() * p.getRisk())
                .sum();
        return totalRisk / totalCapital;
    }

    /**
     * All metrics for one return series. The drawdown is taken over the equity curve
     * obtained by compounding the returns from 1.0.
     */
    public PerformanceMetrics summarize(double[] returns, double riskFreeRate, double confidenceLevel) {
        double[] equityCurve = new double[returns.length + 1];
        equityCurve[0] = 1.0;
        long wins = 0;
        for (int i = 0; i < returns.length; i++) {
            equityCurve[i + 1] = equityCurve[i] * (1.0 + returns[i]);
            if (returns[i] > 0) {
                wins++;
            }
        }

        return PerformanceMetrics.builder()
                .sampleSize(returns.length)
                .sharpeRatio(sharpeRatio(returns, riskFreeRate))
                .sortinoRatio(sortinoRatio(returns, riskFreeRate))
                .valueAtRisk(valueAtRisk(returns, confidenceLevel))
                .maxDrawdown(maxDrawdown(equityCurve))
                .winRate(returns.length == 0 ? 0.0 : (double) wins / returns.length)
                .build();
    }
}
