package com.arbtrader.profit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Kelly-criterion position sizing with a hard cap.
 *
 * <p>Formula: f = (p * avgWin - (1 - p) * avgLoss) / avgLoss, clamped to [0, 0.10].
 * The full Kelly fraction is far too aggressive for a strategy whose edge estimate is
 * noisy, so no single trade may take more than 10% of capital regardless of the edge.
 *
 * <p>Returns 0 when the loss size or win probability is zero (no meaningful edge
 * estimate) or when the inputs are not finite.
 */
@Component
public class KellyPositionSizer {

    private static final Logger log = LoggerFactory.getLogger(KellyPositionSizer.class);

    static final BigDecimal MAX_FRACTION = new BigDecimal("0.10");

    public BigDecimal size(
            BigDecimal totalCapital, double winProbability, BigDecimal avgWinAmount, BigDecimal avgLossAmount) {
        if (avgLossAmount.signum() == 0 || winProbability == 0.0) {
            return BigDecimal.ZERO;
        }
        if (Double.isNaN(winProbability) || Double.isInfinite(winProbability)) {
            log.warn("Non-finite win probability {}, sizing to zero", winProbability);
            return BigDecimal.ZERO;
        }

        BigDecimal p = BigDecimal.valueOf(winProbability);
        BigDecimal edge = p.multiply(avgWinAmount).subtract(BigDecimal.ONE.subtract(p).multiply(avgLossAmount));
        BigDecimal kellyFraction = edge.divide(avgLossAmount, 8, RoundingMode.HALF_UP);

        BigDecimal cappedFraction = kellyFraction.max(BigDecimal.ZERO).min(MAX_FRACTION);
        BigDecimal size = totalCapital.multiply(cappedFraction).max(BigDecimal.ZERO);

        log.debug("Kelly sizing: p={}, raw fraction={}, capped={}, size={}", p, kellyFraction, cappedFraction, size);
        return size;
    }
}
