package com.arbtrader.risk;

import com.arbtrader.exception.InvalidConfigurationException;
import java.math.BigDecimal;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Limits enforced by the {@link RiskController}.
 *
 * <p>Seeded at startup from a {@link com.arbtrader.risk.analytics.RiskPreset} plus
 * {@code arbtrader.risk.*} overrides and adjustable at runtime through
 * {@link RiskController#updateLimits(RiskLimitsUpdate)}. The controller holds its own
 * copy; callers only ever see copies.
 */
@Data
@Builder(toBuilder = true)
public class RiskLimits {

    /** Daily realized (or projected) loss at which the kill switch trips (USD, positive). */
    private BigDecimal maxDailyLossUsd;

    /** Largest notional a single trade may take (USD). */
    private BigDecimal maxNotionalUsd;

    private int maxTradesPerHour;

    /** Trading pauses once this many losses have occurred in a row. */
    private int maxConsecutiveLosses;

    private long cooldownAfterLossMs;

    private long minTimeBetweenTradesMs;

    public RiskLimits copy() {
        return toBuilder().build();
    }

    /**
     * @throws InvalidConfigurationException for a missing or negative amount, a non-positive
     *     trade rate or loss streak, or a negative duration
     */
    public void validate() {
        if (maxDailyLossUsd == null || maxDailyLossUsd.signum() < 0) {
            throw invalid("maxDailyLossUsd", maxDailyLossUsd);
        }
        if (maxNotionalUsd == null || maxNotionalUsd.signum() < 0) {
            throw invalid("maxNotionalUsd", maxNotionalUsd);
        }
        if (maxTradesPerHour <= 0) {
            throw invalid("maxTradesPerHour", maxTradesPerHour);
        }
        if (maxConsecutiveLosses <= 0) {
            throw invalid("maxConsecutiveLosses", maxConsecutiveLosses);
        }
        if (cooldownAfterLossMs < 0) {
            throw invalid("cooldownAfterLossMs", cooldownAfterLossMs);
        }
        if (minTimeBetweenTradesMs < 0) {
            throw invalid("minTimeBetweenTradesMs", minTimeBetweenTradesMs);
        }
    }

    private static InvalidConfigurationException invalid(String field, Object value) {
        return new InvalidConfigurationException(
                "Invalid risk limit " + field + ": " + value, Map.of("field", field, "value", String.valueOf(value)));
    }
}
