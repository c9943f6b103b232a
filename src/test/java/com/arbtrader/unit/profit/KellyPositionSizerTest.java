package com.arbtrader.unit.profit;

import static org.assertj.core.api.Assertions.assertThat;

import com.arbtrader.profit.KellyPositionSizer;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for KellyPositionSizer: zero-edge guards and the 10% cap.
 */
class KellyPositionSizerTest {

    private static final BigDecimal CAPITAL = new BigDecimal("10000");

    private final KellyPositionSizer sizer = new KellyPositionSizer();

    @Test
    @DisplayName("Zero average loss sizes to zero")
    void zeroAvgLoss_returnsZero() {
        assertThat(sizer.size(CAPITAL, 0.6, new BigDecimal("10"), BigDecimal.ZERO))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("Zero win probability sizes to zero")
    void zeroWinProbability_returnsZero() {
        assertThat(sizer.size(CAPITAL, 0.0, new BigDecimal("10"), new BigDecimal("5")))
                .isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A strong edge is capped at 10% of capital")
    void strongEdge_cappedAtTenPercent() {
        // (0.9 * 20 - 0.1 * 5) / 5 = 3.5, capped to 0.10
        assertThat(sizer.size(CAPITAL, 0.9, new BigDecimal("20"), new BigDecimal("5")))
                .isEqualByComparingTo("1000");
    }

    @Test
    @DisplayName("A small edge sizes proportionally")
    void smallEdge_proportional() {
        // (0.52 * 10 - 0.48 * 10) / 10 = 0.04
        assertThat(sizer.size(CAPITAL, 0.52, BigDecimal.TEN, BigDecimal.TEN)).isEqualByComparingTo("400");
    }

    @Test
    @DisplayName("A negative edge never produces a negative size")
    void negativeEdge_returnsZero() {
        assertThat(sizer.size(CAPITAL, 0.2, BigDecimal.ONE, BigDecimal.TEN)).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("A NaN win probability sizes to zero")
    void nanProbability_returnsZero() {
        assertThat(sizer.size(CAPITAL, Double.NaN, BigDecimal.TEN, BigDecimal.TEN)).isEqualByComparingTo("0");
    }
}
