package com.arbtrader.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Immutable snapshot of the {@link RiskController}'s state. Times are null until first set. */
@Value
@Builder
public class RiskState {

    boolean killed;
    String killReason;
    BigDecimal dailyPnl;
    int consecutiveLosses;
    Instant lastTradeTime;
    Instant lastLossTime;
    int tradesInLastHour;

    /** Flat view for risk event records. */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("killed", killed);
        snapshot.put("killReason", killReason);
        snapshot.put("dailyPnl", dailyPnl.toPlainString());
        snapshot.put("consecutiveLosses", consecutiveLosses);
        snapshot.put("lastTradeTime", lastTradeTime != null ? lastTradeTime.toString() : null);
        snapshot.put("lastLossTime", lastLossTime != null ? lastLossTime.toString() : null);
        snapshot.put("tradesInLastHour", tradesInLastHour);
        return snapshot;
    }
}
