package com.arbtrader.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the RiskController on every state transition and advisory.
 *
 * <p>Carries the type, severity, a human-readable description and a snapshot of the
 * risk state at the moment of the transition. The RiskEventJournalListener persists
 * these asynchronously; a failed write never affects the in-memory state that produced
 * the event.
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> stateSnapshot;
    private final Instant occurredAt;

    public RiskEvent(
            Object source,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> stateSnapshot,
            Instant occurredAt) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.stateSnapshot = stateSnapshot != null ? new HashMap<>(stateSnapshot) : new HashMap<>();
        this.occurredAt = occurredAt;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Risk state at the time of the event, e.g.
     * {"killed": true, "dailyPnl": "-100.00", "consecutiveLosses": 3}.
     */
    public Map<String, Object> getStateSnapshot() {
        return stateSnapshot;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
