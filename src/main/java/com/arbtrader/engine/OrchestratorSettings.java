package com.arbtrader.engine;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Thresholds and sizes for opportunity evaluation, bound from {@code arbtrader.*}. */
@Value
@Builder
public class OrchestratorSettings {

    /** Notionals tried per route, ascending; the first that qualifies wins. */
    List<BigDecimal> candidateSizesUsd;

    BigDecimal minProfitUsd;

    int slippageBps;

    double confidenceThreshold;

    /** Bounded wait for all route evaluations of one market update. */
    long evaluationTimeoutMs;
}
