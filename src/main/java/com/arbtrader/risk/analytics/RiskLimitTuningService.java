package com.arbtrader.risk.analytics;

import com.arbtrader.domain.model.PerformanceMetrics;
import com.arbtrader.domain.model.TradeRecord;
import com.arbtrader.persistence.TradeJournal;
import com.arbtrader.risk.RiskController;
import com.arbtrader.risk.RiskLimits;
import com.arbtrader.risk.RiskLimitsUpdate;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically retunes the live risk limits from recent performance and the hour of day.
 *
 * <p>Each run starts from the configured base limits, never from the currently live
 * ones, so adjustments do not compound. With fewer than {@code min-sample} journaled
 * trades in the lookback only the time-of-day adjustment is applied. A failed run is
 * logged and the live limits stay as they were.
 *
 * <p>Enabled with {@code arbtrader.risk.tuning.enabled=true}.
 */
@Service
@ConditionalOnProperty(name = "arbtrader.risk.tuning.enabled", havingValue = "true")
public class RiskLimitTuningService {

    private static final Logger log = LoggerFactory.getLogger(RiskLimitTuningService.class);

    private final RiskLimits baseLimits;
    private final RiskController riskController;
    private final RiskLimitAdjuster riskLimitAdjuster;
    private final RiskMetricsCalculator riskMetricsCalculator;
    private final TradeJournal tradeJournal;
    private final Clock clock;
    private final Duration lookback;
    private final int minSample;

    public RiskLimitTuningService(
            RiskLimits baseLimits,
            RiskController riskController,
            RiskLimitAdjuster riskLimitAdjuster,
            RiskMetricsCalculator riskMetricsCalculator,
            TradeJournal tradeJournal,
            Clock clock,
            @Value("${arbtrader.risk.tuning.lookback-hours:24}") long lookbackHours,
            @Value("${arbtrader.risk.tuning.min-sample:10}") int minSample) {
        this.baseLimits = baseLimits.copy();
        this.riskController = riskController;
        this.riskLimitAdjuster = riskLimitAdjuster;
        this.riskMetricsCalculator = riskMetricsCalculator;
        this.tradeJournal = tradeJournal;
        this.clock = clock;
        this.lookback = Duration.ofHours(lookbackHours);
        this.minSample = minSample;
    }

    @Scheduled(
            fixedRateString = "${arbtrader.risk.tuning.interval-ms:3600000}",
            initialDelayString = "${arbtrader.risk.tuning.initial-delay-ms:60000}")
    public void retune() {
        try {
            RiskLimits tuned = computeTunedLimits();
            riskController.updateLimits(RiskLimitsUpdate.from(tuned));
        } catch (RuntimeException e) {
            log.error("Risk limit tuning failed, keeping current limits: {}", e.getMessage(), e);
        }
    }

    RiskLimits computeTunedLimits() {
        Instant now = Instant.now(clock);
        List<TradeRecord> trades = tradeJournal.getTradesSince(now.minus(lookback)).stream()
                .filter(t -> t.getRealizedProfitUsd() != null)
                .toList();

        RiskLimits limits = baseLimits;
        if (trades.size() >= minSample) {
            BigDecimal pnl = trades.stream()
                    .map(TradeRecord::getRealizedProfitUsd)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            double[] returns = trades.stream().mapToDouble(RiskLimitTuningService::returnOf).toArray();
            PerformanceMetrics metrics = riskMetricsCalculator.summarize(returns, 0.0, 0.95);

            log.info(
                    "Recent performance over {} trades: pnl={}, winRate={}, sharpe={}, sortino={}, VaR95={}, maxDrawdown={}",
                    metrics.getSampleSize(),
                    pnl,
                    metrics.getWinRate(),
                    metrics.getSharpeRatio(),
                    metrics.getSortinoRatio(),
                    metrics.getValueAtRisk(),
                    metrics.getMaxDrawdown());
            limits = riskLimitAdjuster.adjustForPerformance(limits, metrics.getWinRate(), pnl);
        } else {
            log.debug("Only {} trades in lookback, skipping performance adjustment", trades.size());
        }

        int hour = ZonedDateTime.ofInstant(now, ZoneOffset.UTC).getHour();
        return riskLimitAdjuster.adjustForTimeOfDay(limits, hour);
    }

    private static double returnOf(TradeRecord trade) {
        if (trade.getNotionalUsd() == null || trade.getNotionalUsd().signum() == 0) {
            return 0.0;
        }
        return trade.getRealizedProfitUsd()
                .divide(trade.getNotionalUsd(), 10, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
