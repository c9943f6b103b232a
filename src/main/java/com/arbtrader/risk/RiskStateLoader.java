package com.arbtrader.risk;

import com.arbtrader.domain.model.DailyAggregate;
import com.arbtrader.domain.model.TradeRecord;
import com.arbtrader.persistence.TradeJournal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Restores the risk controller's daily PnL, loss streak and hourly trade window from
 * the journal on application startup.
 *
 * <p>If the journal cannot be read the controller starts from a clean state and the
 * failure is logged.
 */
@Component
public class RiskStateLoader implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(RiskStateLoader.class);

    private final TradeJournal tradeJournal;
    private final RiskController riskController;
    private final Clock clock;
    private final int recentTradeLimit;

    public RiskStateLoader(
            TradeJournal tradeJournal,
            RiskController riskController,
            Clock clock,
            @Value("${arbtrader.risk.rehydrate-trade-limit:500}") int recentTradeLimit) {
        this.tradeJournal = tradeJournal;
        this.riskController = riskController;
        this.clock = clock;
        this.recentTradeLimit = recentTradeLimit;
    }

    @Override
    public void onApplicationEvent(ApplicationReadyEvent event) {
        load();
    }

    void load() {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        try {
            DailyAggregate aggregate = tradeJournal.getDailyAggregate(today);
            List<TradeRecord> recentTrades = tradeJournal.getRecentTrades(recentTradeLimit);
            riskController.rehydrate(aggregate, recentTrades);
            log.info(
                    "Rehydrated risk state from {} trades today ({} recent records read)",
                    aggregate.getTradeCount(),
                    recentTrades.size());
        } catch (RuntimeException e) {
            log.error("Risk state rehydration failed, starting from a clean state: {}", e.getMessage(), e);
        }
    }
}
