package com.arbtrader.domain.model;

import com.arbtrader.exception.InvalidConfigurationException;
import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * A closed swap loop starting and ending in {@link #getStartToken()}.
 *
 * <p>Routes are generated once at startup by the RouteGenerator and never mutated.
 * Construction validates the loop: at least two legs, every leg swaps two different
 * tokens, consecutive legs chain, and the last leg returns to the start token.
 */
@Value
public class Route {

    String id;
    List<RouteLeg> legs;

    public Route(String id, List<RouteLeg> legs) {
        if (legs == null || legs.size() < 2) {
            throw new InvalidConfigurationException(
                    "Route " + id + " must have at least two legs", Map.of("routeId", String.valueOf(id)));
        }
        for (int i = 0; i < legs.size(); i++) {
            RouteLeg leg = legs.get(i);
            if (leg.getTokenIn().equals(leg.getTokenOut())) {
                throw new InvalidConfigurationException("Route " + id + " leg " + i + " swaps a token for itself");
            }
            RouteLeg next = legs.get((i + 1) % legs.size());
            if (!leg.getTokenOut().equals(next.getTokenIn())) {
                throw new InvalidConfigurationException("Route " + id + " is not a closed loop at leg " + i);
            }
        }
        this.id = id;
        this.legs = List.copyOf(legs);
    }

    public String getStartToken() {
        return legs.get(0).getTokenIn();
    }

    public int getLegCount() {
        return legs.size();
    }
}
