package com.arbtrader.observability;

import com.arbtrader.event.TradeCandidateEvent;
import com.arbtrader.risk.RiskController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for the arbitrage pipeline.
 * <ul>
 *   <li><b>arb.routes.evaluated</b> (counter): route evaluations, one per route per market update</li>
 *   <li><b>arb.candidates.emitted</b> (counter): trade candidates that passed every gate</li>
 *   <li><b>arb.gas.fallbacks</b> (counter): gas estimates that fell back to the fixed estimate</li>
 *   <li><b>arb.evaluation.latency</b> (timer): market update receipt to evaluation complete</li>
 *   <li><b>risk.daily.pnl</b>, <b>risk.consecutive.losses</b>, <b>risk.killed</b> (gauges)</li>
 * </ul>
 * Risk rejections are counted by the RiskController itself under {@code risk.rejections}.
 */
@Service
public class ArbitrageMetrics {

    private final Counter routesEvaluatedCounter;
    private final Counter candidatesEmittedCounter;
    private final Counter gasFallbackCounter;
    private final Timer evaluationTimer;

    public ArbitrageMetrics(MeterRegistry meterRegistry, RiskController riskController) {
        this.routesEvaluatedCounter = Counter.builder("arb.routes.evaluated")
                .description("Route evaluations performed")
                .register(meterRegistry);

        this.candidatesEmittedCounter = Counter.builder("arb.candidates.emitted")
                .description("Trade candidates authorized and emitted")
                .register(meterRegistry);

        this.gasFallbackCounter = Counter.builder("arb.gas.fallbacks")
                .description("Gas estimates served from the fixed fallback")
                .register(meterRegistry);

        this.evaluationTimer = Timer.builder("arb.evaluation.latency")
                .description("Market update evaluation latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(meterRegistry);

        meterRegistry.gauge("risk.daily.pnl", riskController, controller -> controller.getState()
                .getDailyPnl()
                .doubleValue());
        meterRegistry.gauge("risk.consecutive.losses", riskController, controller -> controller.getState()
                .getConsecutiveLosses());
        meterRegistry.gauge("risk.killed", riskController, controller -> controller.isKilled() ? 1.0 : 0.0);
    }

    public void recordRouteEvaluated() {
        routesEvaluatedCounter.increment();
    }

    public void recordGasFallback() {
        gasFallbackCounter.increment();
    }

    public void recordEvaluation(long receivedAtNanos) {
        evaluationTimer.record(System.nanoTime() - receivedAtNanos, TimeUnit.NANOSECONDS);
    }

    @EventListener
    @Order(20)
    public void onTradeCandidate(TradeCandidateEvent event) {
        candidatesEmittedCounter.increment();
    }
}
