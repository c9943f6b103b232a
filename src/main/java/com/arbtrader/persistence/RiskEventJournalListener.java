package com.arbtrader.persistence;

import com.arbtrader.domain.model.RiskEventRecord;
import com.arbtrader.event.RiskEvent;
import com.arbtrader.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Writes every {@link RiskEvent} to the journal off the publishing thread.
 * A failed write is logged; the controller state that produced the event stands.
 */
@Component
public class RiskEventJournalListener {

    private static final Logger log = LoggerFactory.getLogger(RiskEventJournalListener.class);

    private final TradeJournal tradeJournal;

    public RiskEventJournalListener(TradeJournal tradeJournal) {
        this.tradeJournal = tradeJournal;
    }

    @Async("eventExecutor")
    @EventListener
    public void onRiskEvent(RiskEvent event) {
        RiskEventRecord record = RiskEventRecord.builder()
                .type(event.getEventType())
                .description(event.getMessage())
                .stateSnapshot(event.getStateSnapshot())
                .timestamp(event.getOccurredAt())
                .build();
        try {
            tradeJournal.saveRiskEvent(record);
        } catch (PersistenceException e) {
            log.error("Risk event {} not journaled: {}", event.getEventType(), e.getMessage(), e);
        }
    }
}
