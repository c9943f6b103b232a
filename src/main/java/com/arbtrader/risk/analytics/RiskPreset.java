package com.arbtrader.risk.analytics;

import com.arbtrader.risk.RiskLimits;
import java.math.BigDecimal;
import java.util.Locale;

/** Named starting points for {@link RiskLimits}, selected with {@code arbtrader.risk.preset}. */
public enum RiskPreset {
    CONSERVATIVE(25, 100, 20, 3, 300_000L, 30_000L),
    MODERATE(50, 200, 50, 5, 60_000L, 10_000L),
    AGGRESSIVE(100, 500, 100, 7, 30_000L, 5_000L);

    private final long maxDailyLossUsd;
    private final long maxNotionalUsd;
    private final int maxTradesPerHour;
    private final int maxConsecutiveLosses;
    private final long cooldownAfterLossMs;
    private final long minTimeBetweenTradesMs;

    RiskPreset(
            long maxDailyLossUsd,
            long maxNotionalUsd,
            int maxTradesPerHour,
            int maxConsecutiveLosses,
            long cooldownAfterLossMs,
            long minTimeBetweenTradesMs) {
        this.maxDailyLossUsd = maxDailyLossUsd;
        this.maxNotionalUsd = maxNotionalUsd;
        this.maxTradesPerHour = maxTradesPerHour;
        this.maxConsecutiveLosses = maxConsecutiveLosses;
        this.cooldownAfterLossMs = cooldownAfterLossMs;
        this.minTimeBetweenTradesMs = minTimeBetweenTradesMs;
    }

    /** A fresh, mutable copy of the preset's limits. */
    public RiskLimits toLimits() {
        return RiskLimits.builder()
                .maxDailyLossUsd(BigDecimal.valueOf(maxDailyLossUsd))
                .maxNotionalUsd(BigDecimal.valueOf(maxNotionalUsd))
                .maxTradesPerHour(maxTradesPerHour)
                .maxConsecutiveLosses(maxConsecutiveLosses)
                .cooldownAfterLossMs(cooldownAfterLossMs)
                .minTimeBetweenTradesMs(minTimeBetweenTradesMs)
                .build();
    }

    /** Case-insensitive lookup, e.g. "moderate". */
    public static RiskPreset fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
