package com.arbtrader.event;

import java.time.Instant;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the reserve subscription when a watched pool changes.
 *
 * <p>The event only signals that reserves moved; the orchestrator re-reads every leg's
 * reserves through the ReserveReader so all routes of one update see a consistent
 * snapshot. {@code receivedAt} is a nanoTime stamp for latency measurement.
 */
public class MarketUpdateEvent extends ApplicationEvent {

    private final String venue;
    private final String pairAddress;
    private final Instant observedAt;
    private final long receivedAt;

    public MarketUpdateEvent(Object source, String venue, String pairAddress, Instant observedAt) {
        super(source);
        this.venue = venue;
        this.pairAddress = pairAddress;
        this.observedAt = observedAt;
        this.receivedAt = System.nanoTime();
    }

    public String getVenue() {
        return venue;
    }

    public String getPairAddress() {
        return pairAddress;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public long getReceivedAt() {
        return receivedAt;
    }
}
