package com.arbtrader.scoring;

import com.arbtrader.amm.AmmCalculator;
import com.arbtrader.domain.model.FeatureVector;
import com.arbtrader.domain.model.GasEstimate;
import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.domain.model.Route;
import com.arbtrader.domain.model.RouteLeg;
import com.arbtrader.domain.model.TokenRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.commons.math3.stat.descriptive.SynchronizedDescriptiveStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link FeatureVector} for a candidate from the reserves it was simulated on.
 *
 * <p>Spread is the composite deviation from parity around the route's loop. Depth is
 * twice the USD value of the shallowest input reserve along the route. Volatility is
 * the standard deviation of the route's spread over its last {@code window} observations,
 * 0 until two have been recorded.
 */
@Component
public class FeatureExtractor {

    private static final BigDecimal WEI_PER_GWEI = BigDecimal.valueOf(1_000_000_000L);

    private final AmmCalculator ammCalculator;
    private final TokenRegistry tokenRegistry;
    private final Clock clock;
    private final int window;
    private final Map<String, SynchronizedDescriptiveStatistics> spreadHistory = new ConcurrentHashMap<>();

    public FeatureExtractor(
            AmmCalculator ammCalculator,
            TokenRegistry tokenRegistry,
            Clock clock,
            @Value("${arbtrader.scoring.volatility-window:50}") int window) {
        this.ammCalculator = ammCalculator;
        this.tokenRegistry = tokenRegistry;
        this.clock = clock;
        this.window = window;
    }

    /** Computes the route's current spread and adds it to the route's volatility window. */
    public double recordSpread(Route route, List<ReservePair> legReserves) {
        double spreadBps = ammCalculator.compositeSpreadBps(legReserves);
        spreadHistory
                .computeIfAbsent(route.getId(), id -> new SynchronizedDescriptiveStatistics(window))
                .addValue(spreadBps);
        return spreadBps;
    }

    public double volatility(Route route) {
        SynchronizedDescriptiveStatistics history = spreadHistory.get(route.getId());
        if (history == null || history.getN() < 2) {
            return 0.0;
        }
        return history.getStandardDeviation();
    }

    /**
     * @throws com.arbtrader.exception.DataUnavailableException if a token on the route has no
     *     configured price
     */
    public FeatureVector extract(
            Route route, List<ReservePair> legReserves, double spreadBps, BigDecimal notionalUsd, GasEstimate gas) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));

        return FeatureVector.builder()
                .spreadBps(spreadBps)
                .depthUsd(depthUsd(route, legReserves))
                .volatility(volatility(route))
                .sizeTier(sizeTier(notionalUsd))
                .gasPriceGwei(new BigDecimal(gas.getGasPriceWei())
                        .divide(WEI_PER_GWEI)
                        .doubleValue())
                .timeOfDay(now.getHour() + now.getMinute() / 60.0)
                .dayOfWeek(now.getDayOfWeek().getValue() % 7)
                .build();
    }

    double depthUsd(Route route, List<ReservePair> legReserves) {
        double shallowest = Double.MAX_VALUE;
        for (int i = 0; i < legReserves.size(); i++) {
            RouteLeg leg = route.getLegs().get(i);
            double reserveUsd = tokenRegistry
                    .toUsd(leg.getTokenIn(), legReserves.get(i).getReserveIn())
                    .doubleValue();
            shallowest = Math.min(shallowest, reserveUsd);
        }
        return shallowest == Double.MAX_VALUE ? 0.0 : shallowest * 2.0;
    }

    static int sizeTier(BigDecimal notionalUsd) {
        if (notionalUsd.compareTo(BigDecimal.valueOf(100)) <= 0) {
            return 1;
        }
        if (notionalUsd.compareTo(BigDecimal.valueOf(500)) <= 0) {
            return 2;
        }
        if (notionalUsd.compareTo(BigDecimal.valueOf(1000)) <= 0) {
            return 3;
        }
        return 4;
    }
}
