package com.arbtrader.engine;

import com.arbtrader.domain.model.Route;
import com.arbtrader.domain.model.RouteLeg;
import com.arbtrader.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the fixed route set from the configured tokens and the two venues.
 *
 * <p><b>Triangular:</b> every ordered triple of distinct tokens X, Y, Z gives
 * X->Y on venue A, Y->Z on venue B, Z->X on venue A.
 * <p><b>Cross-venue:</b> every ordered pair X, Y gives X->Y on venue A, Y->X on venue B.
 */
@Component
public class RouteGenerator {

    private static final Logger log = LoggerFactory.getLogger(RouteGenerator.class);

    /**
     * @throws InvalidConfigurationException for duplicate tokens, identical venues, or a
     *     configuration that yields no route
     */
    public List<Route> generate(
            List<String> tokens, String venueA, String venueB, boolean triangular, boolean crossVenue) {
        if (new LinkedHashSet<>(tokens).size() != tokens.size()) {
            throw new InvalidConfigurationException("Duplicate token in " + tokens, Map.of("tokens", tokens.toString()));
        }
        if (venueA.equals(venueB)) {
            throw new InvalidConfigurationException("Routes need two distinct venues, got " + venueA + " twice");
        }

        List<Route> routes = new ArrayList<>();
        if (crossVenue) {
            for (String x : tokens) {
                for (String y : tokens) {
                    if (!x.equals(y)) {
                        routes.add(route(List.of(new RouteLeg(x, y, venueA), new RouteLeg(y, x, venueB))));
                    }
                }
            }
        }
        if (triangular) {
            for (String x : tokens) {
                for (String y : tokens) {
                    for (String z : tokens) {
                        if (x.equals(y) || y.equals(z) || x.equals(z)) {
                            continue;
                        }
                        routes.add(route(List.of(
                                new RouteLeg(x, y, venueA), new RouteLeg(y, z, venueB), new RouteLeg(z, x, venueA))));
                    }
                }
            }
        }

        if (routes.isEmpty()) {
            throw new InvalidConfigurationException("No routes generated from tokens " + tokens);
        }
        log.info("Generated {} routes over {} tokens ({} / {})", routes.size(), tokens.size(), venueA, venueB);
        return List.copyOf(routes);
    }

    private static Route route(List<RouteLeg> legs) {
        StringBuilder id = new StringBuilder();
        for (RouteLeg leg : legs) {
            if (id.length() > 0) {
                id.append('|');
            }
            id.append(leg);
        }
        return new Route(id.toString(), legs);
    }
}
