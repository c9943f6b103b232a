package com.arbtrader.engine;

import com.arbtrader.amm.AmmCalculator;
import com.arbtrader.connector.ConfidenceScorer;
import com.arbtrader.connector.ReserveReader;
import com.arbtrader.domain.model.FeatureVector;
import com.arbtrader.domain.model.GasEstimate;
import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.domain.model.Route;
import com.arbtrader.domain.model.RouteLeg;
import com.arbtrader.domain.model.TokenRegistry;
import com.arbtrader.domain.model.TradeCandidate;
import com.arbtrader.event.MarketUpdateEvent;
import com.arbtrader.event.TradeCandidateEvent;
import com.arbtrader.exception.InvalidConfigurationException;
import com.arbtrader.observability.ArbitrageMetrics;
import com.arbtrader.profit.GasEstimator;
import com.arbtrader.risk.RiskController;
import com.arbtrader.scoring.FeatureExtractor;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Turns market updates into risk-approved trade candidates.
 *
 * <p><b>Per market update:</b>
 * <ol>
 *   <li>Skip everything while the risk controller is killed</li>
 *   <li>Price all routes in parallel on the route executor against one shared reserve
 *       snapshot, waiting at most {@code evaluationTimeoutMs}</li>
 *   <li>In route order, ask the risk controller to approve each route's qualifying sizes
 *       and publish a {@link TradeCandidateEvent} for the first approved one before moving
 *       to the next route</li>
 * </ol>
 * Approval and publication are sequential so a synchronous executor books each fill
 * before the next route is checked, and spacing and hourly limits see every trade of the
 * same update.
 *
 * <p><b>Per route:</b> read every leg's reserves (a missing leg aborts the route), estimate
 * gas once, then walk the candidate sizes in ascending order. A size qualifies when its
 * net profit in start-token base units is positive, its USD value reaches
 * {@code minProfitUsd} and its confidence score reaches the threshold.
 *
 * <p>Gas and slippage are converted into start-token base units rounding up, and profit
 * back to USD rounding down, so the conversion can only understate profit.
 *
 * <p>Updates are processed one at a time; a failure in one route is logged and never
 * affects the others.
 */
@Service
public class OpportunityOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(OpportunityOrchestrator.class);

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final List<Route> routes;
    private final ReserveReader reserveReader;
    private final AmmCalculator ammCalculator;
    private final GasEstimator gasEstimator;
    private final FeatureExtractor featureExtractor;
    private final ConfidenceScorer confidenceScorer;
    private final RiskController riskController;
    private final TokenRegistry tokenRegistry;
    private final OrchestratorSettings settings;
    private final ArbitrageMetrics arbitrageMetrics;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Executor routeExecutor;

    public OpportunityOrchestrator(
            List<Route> routes,
            ReserveReader reserveReader,
            AmmCalculator ammCalculator,
            GasEstimator gasEstimator,
            FeatureExtractor featureExtractor,
            ConfidenceScorer confidenceScorer,
            RiskController riskController,
            TokenRegistry tokenRegistry,
            OrchestratorSettings settings,
            ArbitrageMetrics arbitrageMetrics,
            ApplicationEventPublisher applicationEventPublisher,
            @Qualifier("routeExecutor") Executor routeExecutor) {
        this.routes = List.copyOf(routes);
        this.reserveReader = reserveReader;
        this.ammCalculator = ammCalculator;
        this.gasEstimator = gasEstimator;
        this.featureExtractor = featureExtractor;
        this.confidenceScorer = confidenceScorer;
        this.riskController = riskController;
        this.tokenRegistry = tokenRegistry;
        this.settings = settings;
        this.arbitrageMetrics = arbitrageMetrics;
        this.applicationEventPublisher = applicationEventPublisher;
        this.routeExecutor = routeExecutor;
    }

    @EventListener
    public void onMarketUpdate(MarketUpdateEvent event) {
        evaluate(event);
    }

    /**
     * Evaluates every route against a fresh reserve snapshot.
     *
     * @return the emitted candidates, at most one per route, in route order
     */
    public synchronized List<TradeCandidate> evaluate(MarketUpdateEvent event) {
        if (riskController.isKilled()) {
            log.debug("Kill switch active, skipping market update from {}", event.getVenue());
            return List.of();
        }

        Map<String, Optional<ReservePair>> snapshot = new ConcurrentHashMap<>();
        List<CompletableFuture<List<TradeCandidate>>> futures = new ArrayList<>(routes.size());
        for (Route route : routes) {
            futures.add(CompletableFuture.supplyAsync(() -> evaluateRouteSafely(route, snapshot), routeExecutor));
        }

        awaitAll(futures);

        List<TradeCandidate> candidates = new ArrayList<>();
        for (CompletableFuture<List<TradeCandidate>> future : futures) {
            if (future.isDone() && !future.isCompletedExceptionally()) {
                approveFirst(future.join()).ifPresent(candidates::add);
            } else {
                future.cancel(true);
            }
        }

        arbitrageMetrics.recordEvaluation(event.getReceivedAt());
        return candidates;
    }

    private Optional<TradeCandidate> approveFirst(List<TradeCandidate> qualifyingSizes) {
        for (TradeCandidate candidate : qualifyingSizes) {
            if (riskController.isKilled()) {
                return Optional.empty();
            }
            if (!riskController.canTrade(candidate.getNotionalUsd(), candidate.getNetProfitUsd())) {
                continue;
            }
            log.info(
                    "Trade candidate: route={}, notional={}, netProfitUsd={}, score={}",
                    candidate.getRoute().getId(),
                    candidate.getNotionalUsd(),
                    candidate.getNetProfitUsd(),
                    candidate.getConfidenceScore());
            applicationEventPublisher.publishEvent(new TradeCandidateEvent(this, candidate));
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private void awaitAll(List<CompletableFuture<List<TradeCandidate>>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(settings.getEvaluationTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn(
                    "Route evaluation exceeded {}ms, using routes completed so far", settings.getEvaluationTimeoutMs());
        } catch (ExecutionException e) {
            log.error("Route evaluation failed: {}", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for route evaluation");
        }
    }

    private List<TradeCandidate> evaluateRouteSafely(Route route, Map<String, Optional<ReservePair>> snapshot) {
        arbitrageMetrics.recordRouteEvaluated();
        try {
            return evaluateRoute(route, snapshot);
        } catch (InvalidConfigurationException e) {
            log.error("Skipping misconfigured route {}: {}", route.getId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Route {} evaluation failed: {}", route.getId(), e.getMessage(), e);
        }
        return List.of();
    }

    /** The route's sizes that pass the profit and confidence gates, smallest first. */
    List<TradeCandidate> evaluateRoute(Route route, Map<String, Optional<ReservePair>> snapshot) {
        List<ReservePair> legReserves = new ArrayList<>(route.getLegCount());
        for (RouteLeg leg : route.getLegs()) {
            Optional<ReservePair> reserves = snapshot.computeIfAbsent(
                    leg.toString(), key -> reserveReader.getReserves(leg.getTokenIn(), leg.getTokenOut(), leg.getVenue()));
            if (reserves.isEmpty()) {
                log.debug("No reserves for {}, skipping route {}", leg, route.getId());
                return List.of();
            }
            legReserves.add(reserves.get());
        }

        double spreadBps = featureExtractor.recordSpread(route, legReserves);
        GasEstimate gas = gasEstimator.estimate();
        String startToken = route.getStartToken();
        BigInteger gasCost = tokenRegistry.toBaseUnits(startToken, gas.getCostUsd(), RoundingMode.CEILING);
        BigDecimal maxNotionalUsd = riskController.getLimits().getMaxNotionalUsd();

        List<TradeCandidate> qualifying = new ArrayList<>();
        for (BigDecimal notionalUsd : settings.getCandidateSizesUsd()) {
            if (notionalUsd.compareTo(maxNotionalUsd) > 0) {
                continue;
            }
            BigInteger amountIn = tokenRegistry.toBaseUnits(startToken, notionalUsd);
            if (amountIn.signum() <= 0) {
                continue;
            }

            List<BigInteger> perLegOut = ammCalculator.simulateRoute(amountIn, legReserves);
            BigInteger grossProfit = perLegOut.get(perLegOut.size() - 1).subtract(amountIn);
            BigInteger slippageCost = slippageCost(amountIn);
            BigInteger netProfit = grossProfit.subtract(gasCost).subtract(slippageCost);
            BigDecimal netProfitUsd = tokenRegistry.toUsd(startToken, netProfit);

            if (netProfit.signum() <= 0 || netProfitUsd.compareTo(settings.getMinProfitUsd()) < 0) {
                log.trace("Route {} at {} USD nets {} USD, below minimum", route.getId(), notionalUsd, netProfitUsd);
                continue;
            }

            OptionalDouble score = score(route, legReserves, spreadBps, notionalUsd, gas);
            if (score.isEmpty()) {
                continue;
            }
            if (score.getAsDouble() < settings.getConfidenceThreshold()) {
                log.debug(
                        "Route {} at {} USD scored {}, below threshold {}",
                        route.getId(),
                        notionalUsd,
                        score.getAsDouble(),
                        settings.getConfidenceThreshold());
                continue;
            }

            qualifying.add(TradeCandidate.builder()
                    .route(route)
                    .notionalUsd(notionalUsd)
                    .amountIn(amountIn)
                    .perLegAmountOut(perLegOut)
                    .grossProfit(grossProfit)
                    .gasCost(gasCost)
                    .slippageCost(slippageCost)
                    .netProfit(netProfit)
                    .netProfitUsd(netProfitUsd)
                    .gasEstimate(gas)
                    .confidenceScore(score.getAsDouble())
                    .build());
        }
        return qualifying;
    }

    private OptionalDouble score(
            Route route, List<ReservePair> legReserves, double spreadBps, BigDecimal notionalUsd, GasEstimate gas) {
        try {
            FeatureVector features = featureExtractor.extract(route, legReserves, spreadBps, notionalUsd, gas);
            return OptionalDouble.of(confidenceScorer.score(features));
        } catch (RuntimeException e) {
            log.warn("Scoring failed for route {} at {} USD: {}", route.getId(), notionalUsd, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    /** {@code ceil(amountIn * slippageBps / 10000)}. */
    private BigInteger slippageCost(BigInteger amountIn) {
        BigInteger scaled = amountIn.multiply(BigInteger.valueOf(settings.getSlippageBps()));
        BigInteger[] quotientAndRemainder = scaled.divideAndRemainder(BPS);
        return quotientAndRemainder[1].signum() > 0
                ? quotientAndRemainder[0].add(BigInteger.ONE)
                : quotientAndRemainder[0];
    }
}
