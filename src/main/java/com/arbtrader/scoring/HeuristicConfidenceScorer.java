package com.arbtrader.scoring;

import com.arbtrader.connector.ConfidenceScorer;
import com.arbtrader.domain.model.FeatureVector;
import com.arbtrader.exception.DataUnavailableException;
import org.springframework.stereotype.Component;

/**
 * Rule-based stand-in for a trained model: a weighted sum of normalized features,
 * clamped to [0, 1].
 *
 * <p>Normalization: spread / 1000, ln(depth) / 20, volatility / 100, sizeTier / 4,
 * gas gwei / 100, hour / 24, day / 7. Volatility and gas count inversely.
 */
@Component
public class HeuristicConfidenceScorer implements ConfidenceScorer {

    static final double SPREAD_WEIGHT = 0.30;
    static final double DEPTH_WEIGHT = 0.20;
    static final double VOLATILITY_WEIGHT = 0.15;
    static final double SIZE_TIER_WEIGHT = 0.10;
    static final double GAS_WEIGHT = 0.10;
    static final double TIME_OF_DAY_WEIGHT = 0.08;
    static final double DAY_OF_WEEK_WEIGHT = 0.07;

    @Override
    public double score(FeatureVector features) {
        double[] normalized = normalize(features);
        for (double value : normalized) {
            if (!Double.isFinite(value)) {
                throw new DataUnavailableException("Feature vector has non-finite values: " + features);
            }
        }

        double score = normalized[0] * SPREAD_WEIGHT
                + normalized[1] * DEPTH_WEIGHT
                + (1.0 - normalized[2]) * VOLATILITY_WEIGHT
                + normalized[3] * SIZE_TIER_WEIGHT
                + (1.0 - normalized[4]) * GAS_WEIGHT
                + normalized[5] * TIME_OF_DAY_WEIGHT
                + normalized[6] * DAY_OF_WEEK_WEIGHT;
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double[] normalize(FeatureVector features) {
        return new double[] {
            features.getSpreadBps() / 1000.0,
            features.getDepthUsd() > 1.0 ? Math.log(features.getDepthUsd()) / 20.0 : 0.0,
            features.getVolatility() / 100.0,
            features.getSizeTier() / 4.0,
            features.getGasPriceGwei() / 100.0,
            features.getTimeOfDay() / 24.0,
            features.getDayOfWeek() / 7.0
        };
    }
}
