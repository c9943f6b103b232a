package com.arbtrader.persistence;

import com.arbtrader.domain.model.DailyAggregate;
import com.arbtrader.domain.model.RiskEventRecord;
import com.arbtrader.domain.model.TradeRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Append-only store of trade records and risk events.
 *
 * <p>Write failures surface as {@link com.arbtrader.exception.PersistenceException};
 * callers log them and carry on.
 */
public interface TradeJournal {

    TradeRecord saveTrade(TradeRecord trade);

    RiskEventRecord saveRiskEvent(RiskEventRecord event);

    /** Aggregate over trades executed on {@code date} (UTC); empty aggregate when there were none. */
    DailyAggregate getDailyAggregate(LocalDate date);

    /** The latest {@code limit} trades, newest first. */
    List<TradeRecord> getRecentTrades(int limit);

    /** Trades executed at or after {@code since}, newest first. */
    List<TradeRecord> getTradesSince(Instant since);
}
