package com.arbtrader.unit.risk.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import com.arbtrader.domain.model.PerformanceMetrics;
import com.arbtrader.risk.analytics.PositionRisk;
import com.arbtrader.risk.analytics.RiskMetricsCalculator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for RiskMetricsCalculator. */
class RiskMetricsCalculatorTest {

    private static final double[] RETURNS = {-0.10, -0.05, 0.02, 0.08, 0.15, -0.02, 0.06, -0.01, 0.04, 0.12};

    private final RiskMetricsCalculator calculator = new RiskMetricsCalculator();

    @Nested
    @DisplayName("Value at Risk")
    class ValueAtRisk {

        @Test
        @DisplayName("95% historical VaR of ten returns is the worst return")
        void var95() {
            assertThat(calculator.valueAtRisk(RETURNS, 0.95)).isEqualTo(-0.10);
        }

        @Test
        @DisplayName("80% VaR picks the second-worst return")
        void var80() {
            assertThat(calculator.valueAtRisk(RETURNS, 0.80)).isEqualTo(-0.05);
        }

        @Test
        @DisplayName("Empty series has zero VaR")
        void empty() {
            assertThat(calculator.valueAtRisk(new double[0], 0.95)).isZero();
        }
    }

    @Nested
    @DisplayName("Ratios")
    class Ratios {

        @Test
        @DisplayName("Sharpe uses the population standard deviation")
        void sharpe() {
            assertThat(calculator.sharpeRatio(new double[] {0.01, 0.03}, 0.0)).isCloseTo(2.0, offset(1e-9));
        }

        @Test
        @DisplayName("Sharpe is zero for a single return or a flat series")
        void sharpeDegenerate() {
            assertThat(calculator.sharpeRatio(new double[] {0.05}, 0.0)).isZero();
            assertThat(calculator.sharpeRatio(new double[] {0.02, 0.02, 0.02}, 0.0)).isZero();
        }

        @Test
        @DisplayName("Sortino is infinite without negative returns")
        void sortinoNoDownside() {
            assertThat(calculator.sortinoRatio(new double[] {0.01, 0.02}, 0.0)).isEqualTo(Double.POSITIVE_INFINITY);
        }

        @Test
        @DisplayName("Sortino divides by the downside deviation")
        void sortino() {
            // mean = -0.02 / 3, downside deviation = sqrt((0.0001 + 0.0009) / 2)
            double sortino = calculator.sortinoRatio(new double[] {0.02, -0.01, -0.03}, 0.0);

            assertThat(sortino).isCloseTo(-0.29814, offset(1e-4));
        }
    }

    @Nested
    @DisplayName("Drawdown and Heat")
    class DrawdownAndHeat {

        @Test
        @DisplayName("Max drawdown is the deepest fall from a running peak")
        void maxDrawdown() {
            double[] equity = {100, 120, 90, 110, 60, 130};

            assertThat(calculator.maxDrawdown(equity)).isCloseTo(0.5, offset(1e-12));
        }

        @Test
        @DisplayName("A rising curve has no drawdown")
        void noDrawdown() {
            assertThat(calculator.maxDrawdown(new double[] {1, 2, 3})).isZero();
        }

        @Test
        @DisplayName("Portfolio heat is total risk over capital")
        void portfolioHeat() {
            List<PositionRisk> positions = List.of(new PositionRisk(1000, 0.02), new PositionRisk(500, 0.04));

            assertThat(calculator.portfolioHeat(positions, 10_000)).isCloseTo(0.004, offset(1e-12));
            assertThat(calculator.portfolioHeat(positions, 0)).isZero();
        }
    }

    @Test
    @DisplayName("Summary compounds returns into an equity curve")
    void summarize() {
        PerformanceMetrics metrics = calculator.summarize(new double[] {0.1, -0.5, 0.2}, 0.0, 0.95);

        assertThat(metrics.getSampleSize()).isEqualTo(3);
        assertThat(metrics.getWinRate()).isCloseTo(2.0 / 3, offset(1e-12));
        assertThat(metrics.getMaxDrawdown()).isCloseTo(0.5, offset(1e-12));
        assertThat(metrics.getValueAtRisk()).isEqualTo(-0.5);
    }
}
