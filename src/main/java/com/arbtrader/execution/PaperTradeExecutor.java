package com.arbtrader.execution;

import com.arbtrader.domain.enums.TradeMode;
import com.arbtrader.domain.enums.TradeStatus;
import com.arbtrader.domain.model.TradeCandidate;
import com.arbtrader.domain.model.TradeOutcome;
import com.arbtrader.domain.model.TradeRecord;
import com.arbtrader.event.TradeCandidateEvent;
import com.arbtrader.exception.PersistenceException;
import com.arbtrader.persistence.TradeJournal;
import com.arbtrader.risk.RiskController;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Simulated execution for paper mode: every candidate "fills" at exactly its expected
 * profit. The fill is journaled and fed back to the risk controller as a realized outcome,
 * so the risk limits behave as they would live. A journal failure is logged and the
 * outcome is still recorded.
 */
@Component
@ConditionalOnProperty(name = "arbtrader.mode", havingValue = "paper", matchIfMissing = true)
public class PaperTradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaperTradeExecutor.class);

    private final TradeJournal tradeJournal;
    private final RiskController riskController;
    private final Clock clock;

    public PaperTradeExecutor(TradeJournal tradeJournal, RiskController riskController, Clock clock) {
        this.tradeJournal = tradeJournal;
        this.riskController = riskController;
        this.clock = clock;
    }

    @EventListener
    @Order(10)
    public void onTradeCandidate(TradeCandidateEvent event) {
        TradeCandidate candidate = event.getCandidate();

        TradeRecord trade = TradeRecord.builder()
                .routeId(candidate.getRoute().getId())
                .notionalUsd(candidate.getNotionalUsd())
                .expectedProfitUsd(candidate.getNetProfitUsd())
                .realizedProfitUsd(candidate.getNetProfitUsd())
                .gasCostUsd(candidate.getGasEstimate().getCostUsd())
                .score(candidate.getConfidenceScore())
                .status(TradeStatus.SUCCESS)
                .mode(TradeMode.PAPER)
                .executedAt(Instant.now(clock))
                .build();

        try {
            tradeJournal.saveTrade(trade);
        } catch (PersistenceException e) {
            log.error("Paper trade on {} not journaled: {}", trade.getRouteId(), e.getMessage(), e);
        }

        riskController.recordTrade(TradeOutcome.of(candidate.getNotionalUsd(), candidate.getNetProfitUsd()));
        log.info("Paper trade filled: route={}, profit={} USD", trade.getRouteId(), trade.getRealizedProfitUsd());
    }
}
