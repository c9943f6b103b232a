package com.arbtrader.config;

import com.arbtrader.risk.RiskLimits;
import com.arbtrader.risk.analytics.LiquidityWindows;
import com.arbtrader.risk.analytics.RiskPreset;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the base {@link RiskLimits} bean from application.properties.
 *
 * <p>Limits start from the named preset ({@code arbtrader.risk.preset}, default moderate);
 * any individually set property overrides the preset's value. Invalid limits fail
 * startup with an InvalidConfigurationException.
 *
 * <p>Properties prefix: {@code arbtrader.risk.*}
 */
@Configuration
public class RiskConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskConfig.class);

    @Bean
    public RiskLimits riskLimits(
            @Value("${arbtrader.risk.preset:moderate}") String preset,
            @Value("${arbtrader.risk.max-daily-loss-usd:#{null}}") BigDecimal maxDailyLossUsd,
            @Value("${arbtrader.risk.max-notional-usd:#{null}}") BigDecimal maxNotionalUsd,
            @Value("${arbtrader.risk.max-trades-per-hour:#{null}}") Integer maxTradesPerHour,
            @Value("${arbtrader.risk.max-consecutive-losses:#{null}}") Integer maxConsecutiveLosses,
            @Value("${arbtrader.risk.cooldown-after-loss-ms:#{null}}") Long cooldownAfterLossMs,
            @Value("${arbtrader.risk.min-time-between-trades-ms:#{null}}") Long minTimeBetweenTradesMs) {
        RiskLimits limits = RiskPreset.fromName(preset).toLimits();
        if (maxDailyLossUsd != null) {
            limits.setMaxDailyLossUsd(maxDailyLossUsd);
        }
        if (maxNotionalUsd != null) {
            limits.setMaxNotionalUsd(maxNotionalUsd);
        }
        if (maxTradesPerHour != null) {
            limits.setMaxTradesPerHour(maxTradesPerHour);
        }
        if (maxConsecutiveLosses != null) {
            limits.setMaxConsecutiveLosses(maxConsecutiveLosses);
        }
        if (cooldownAfterLossMs != null) {
            limits.setCooldownAfterLossMs(cooldownAfterLossMs);
        }
        if (minTimeBetweenTradesMs != null) {
            limits.setMinTimeBetweenTradesMs(minTimeBetweenTradesMs);
        }
        limits.validate();
        log.info("Risk limits ({} preset with overrides): {}", preset, limits);
        return limits;
    }

    @Bean
    public LiquidityWindows liquidityWindows(
            @Value("${arbtrader.risk.low-liquidity.start-hour:22}") int lowStartHour,
            @Value("${arbtrader.risk.low-liquidity.end-hour:6}") int lowEndHour,
            @Value("${arbtrader.risk.low-liquidity.multiplier:0.7}") double lowMultiplier,
            @Value("${arbtrader.risk.peak.start-hour:14}") int peakStartHour,
            @Value("${arbtrader.risk.peak.end-hour:18}") int peakEndHour,
            @Value("${arbtrader.risk.peak.multiplier:1.2}") double peakMultiplier) {
        return LiquidityWindows.builder()
                .lowLiquidityStartHour(lowStartHour)
                .lowLiquidityEndHour(lowEndHour)
                .lowLiquidityMultiplier(lowMultiplier)
                .peakStartHour(peakStartHour)
                .peakEndHour(peakEndHour)
                .peakMultiplier(peakMultiplier)
                .build();
    }
}
