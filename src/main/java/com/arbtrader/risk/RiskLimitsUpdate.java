package com.arbtrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Partial risk limits for {@link RiskController#updateLimits}; null fields are left unchanged. */
@Value
@Builder
public class RiskLimitsUpdate {

    BigDecimal maxDailyLossUsd;
    BigDecimal maxNotionalUsd;
    Integer maxTradesPerHour;
    Integer maxConsecutiveLosses;
    Long cooldownAfterLossMs;
    Long minTimeBetweenTradesMs;

    /** Full replacement of every field. */
    public static RiskLimitsUpdate from(RiskLimits limits) {
        return RiskLimitsUpdate.builder()
                .maxDailyLossUsd(limits.getMaxDailyLossUsd())
                .maxNotionalUsd(limits.getMaxNotionalUsd())
                .maxTradesPerHour(limits.getMaxTradesPerHour())
                .maxConsecutiveLosses(limits.getMaxConsecutiveLosses())
                .cooldownAfterLossMs(limits.getCooldownAfterLossMs())
                .minTimeBetweenTradesMs(limits.getMinTimeBetweenTradesMs())
                .build();
    }

    RiskLimits applyTo(RiskLimits current) {
        RiskLimits merged = current.copy();
        if (maxDailyLossUsd != null) {
            merged.setMaxDailyLossUsd(maxDailyLossUsd);
        }
        if (maxNotionalUsd != null) {
            merged.setMaxNotionalUsd(maxNotionalUsd);
        }
        if (maxTradesPerHour != null) {
            merged.setMaxTradesPerHour(maxTradesPerHour);
        }
        if (maxConsecutiveLosses != null) {
            merged.setMaxConsecutiveLosses(maxConsecutiveLosses);
        }
        if (cooldownAfterLossMs != null) {
            merged.setCooldownAfterLossMs(cooldownAfterLossMs);
        }
        if (minTimeBetweenTradesMs != null) {
            merged.setMinTimeBetweenTradesMs(minTimeBetweenTradesMs);
        }
        return merged;
    }
}
