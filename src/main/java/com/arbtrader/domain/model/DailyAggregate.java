package com.arbtrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Aggregate of one day's trade records, used to rehydrate the risk state at startup. */
@Value
@Builder
public class DailyAggregate {

    LocalDate date;
    BigDecimal dailyPnl;
    int tradeCount;

    /** Fraction of trades with positive realized profit, in [0, 1]. */
    double winRate;

    public static DailyAggregate empty(LocalDate date) {
        return DailyAggregate.builder()
                .date(date)
                .dailyPnl(BigDecimal.ZERO)
                .tradeCount(0)
                .winRate(0.0)
                .build();
    }
}
