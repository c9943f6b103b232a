package com.arbtrader.risk.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Hour-of-day windows (UTC, inclusive bounds) with their limit multipliers. The
 * low-liquidity window may wrap past midnight, e.g. 22 to 6.
 */
@Value
@Builder
public class LiquidityWindows {

    int lowLiquidityStartHour;
    int lowLiquidityEndHour;
    double lowLiquidityMultiplier;
    int peakStartHour;
    int peakEndHour;
    double peakMultiplier;

    public static LiquidityWindows defaults() {
        return LiquidityWindows.builder()
                .lowLiquidityStartHour(22)
                .lowLiquidityEndHour(6)
                .lowLiquidityMultiplier(0.7)
                .peakStartHour(14)
                .peakEndHour(18)
                .peakMultiplier(1.2)
                .build();
    }

    public double multiplierFor(int hour) {
        if (inWindow(hour, lowLiquidityStartHour, lowLiquidityEndHour)) {
            return lowLiquidityMultiplier;
        }
        if (inWindow(hour, peakStartHour, peakEndHour)) {
            return peakMultiplier;
        }
        return 1.0;
    }

    private static boolean inWindow(int hour, int start, int end) {
        if (start <= end) {
            return hour >= start && hour <= end;
        }
        return hour >= start || hour <= end;
    }
}
