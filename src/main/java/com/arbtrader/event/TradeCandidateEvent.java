package com.arbtrader.event;

import com.arbtrader.domain.model.TradeCandidate;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per route per market update for a candidate that cleared the profit
 * threshold, the confidence threshold and the risk gate. Consumed by the executor
 * (the paper executor in paper mode, an external signer in live mode).
 */
public class TradeCandidateEvent extends ApplicationEvent {

    private final TradeCandidate candidate;

    public TradeCandidateEvent(Object source, TradeCandidate candidate) {
        super(source);
        this.candidate = candidate;
    }

    public TradeCandidate getCandidate() {
        return candidate;
    }
}
