package com.arbtrader.connector;

import com.arbtrader.domain.model.FeatureVector;

/**
 * Scores how likely a simulated opportunity is to realize its expected profit.
 *
 * @see com.arbtrader.scoring.HeuristicConfidenceScorer
 */
public interface ConfidenceScorer {

    /**
     * @return a score in [0, 1]
     * @throws com.arbtrader.exception.DataUnavailableException if the score cannot be computed
     */
    double score(FeatureVector features);
}
