package com.arbtrader.unit.amm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import com.arbtrader.amm.AmmCalculator;
import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.exception.InsufficientLiquidityException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Unit tests for AmmCalculator covering exact swap arithmetic, the inverse quote,
 * route simulation, the optimal two-hop size search and the magnitude-only price helpers.
 */
class AmmCalculatorTest {

    private static final BigInteger E6 = BigInteger.TEN.pow(6);
    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private final AmmCalculator ammCalculator = new AmmCalculator();

    /** Pools of very different depth, decimals and fee: reserveIn, reserveOut, feeBps. */
    static Stream<Arguments> pools() {
        return Stream.of(
                Arguments.of(BigInteger.valueOf(1_000_000).multiply(E6), BigInteger.valueOf(500).multiply(E18), 30),
                Arguments.of(BigInteger.valueOf(500).multiply(E18), BigInteger.valueOf(1_000_000).multiply(E6), 30),
                Arguments.of(BigInteger.valueOf(10_000), BigInteger.valueOf(20_000), 30),
                Arguments.of(BigInteger.valueOf(3_000).multiply(E18), BigInteger.valueOf(7).multiply(E18), 0),
                Arguments.of(BigInteger.valueOf(250_000).multiply(E6), BigInteger.valueOf(249_000).multiply(E6), 100));
    }

    /** Inputs from 1 unit up to ten times the input reserve, roughly geometric. */
    private static List<BigInteger> inputSizes(BigInteger reserveIn) {
        List<BigInteger> sizes = new ArrayList<>();
        for (BigInteger size = BigInteger.ONE;
                size.compareTo(reserveIn.multiply(BigInteger.TEN)) <= 0;
                size = size.multiply(BigInteger.valueOf(7))) {
            sizes.add(size);
            sizes.add(size.add(BigInteger.ONE));
        }
        sizes.add(reserveIn.divide(BigInteger.TWO));
        sizes.add(reserveIn);
        sizes.sort(null);
        return sizes;
    }

    // ==============================
    // AMOUNT OUT
    // ==============================

    @Nested
    @DisplayName("amountOut")
    class AmountOut {

        @Test
        @DisplayName("Matches the constant-product formula with floor division")
        void matchesFormula() {
            BigInteger out = ammCalculator.amountOut(
                    BigInteger.valueOf(1000), BigInteger.valueOf(10_000), BigInteger.valueOf(20_000), 30);

            // effIn = 1000 * 9970 = 9_970_000; out = 9_970_000 * 20_000 / (100_000_000 + 9_970_000)
            assertThat(out).isEqualTo(BigInteger.valueOf(1813));
        }

        @Test
        @DisplayName("Any zero operand yields zero")
        void zeroOperands_returnZero() {
            BigInteger r = BigInteger.valueOf(1_000_000);
            assertThat(ammCalculator.amountOut(BigInteger.ZERO, r, r, 30)).isZero();
            assertThat(ammCalculator.amountOut(BigInteger.TEN, BigInteger.ZERO, r, 30))
                    .isZero();
            assertThat(ammCalculator.amountOut(BigInteger.TEN, r, BigInteger.ZERO, 30))
                    .isZero();
        }

        @Test
        @DisplayName("Output stays strictly below the output reserve for huge inputs")
        void hugeInput_staysBelowReserve() {
            BigInteger reserveOut = BigInteger.valueOf(500).multiply(E18);
            BigInteger out = ammCalculator.amountOut(
                    BigInteger.TEN.pow(40), BigInteger.valueOf(1_000_000).multiply(E6), reserveOut, 30);

            assertThat(out).isLessThan(reserveOut);
        }

        @Test
        @DisplayName("Zero fee gives more output than a 30 bps fee")
        void zeroFee_givesMoreOutput() {
            BigInteger in = BigInteger.valueOf(1_000).multiply(E6);
            BigInteger rIn = BigInteger.valueOf(1_000_000).multiply(E6);
            BigInteger rOut = BigInteger.valueOf(500).multiply(E18);

            assertThat(ammCalculator.amountOut(in, rIn, rOut, 0))
                    .isGreaterThan(ammCalculator.amountOut(in, rIn, rOut, 30));
        }
    }

    // ==============================
    // AMOUNT IN
    // ==============================

    @Nested
    @DisplayName("amountIn")
    class AmountIn {

        @Test
        @DisplayName("Quoted input buys at least the requested output")
        void inverse_coversRequestedOutput() {
            BigInteger rIn = BigInteger.valueOf(1_000_000).multiply(E6);
            BigInteger rOut = BigInteger.valueOf(500).multiply(E18);
            BigInteger wanted = E18;

            BigInteger in = ammCalculator.amountIn(wanted, rIn, rOut, 30);

            assertThat(ammCalculator.amountOut(in, rIn, rOut, 30)).isGreaterThanOrEqualTo(wanted);
            assertThat(ammCalculator.amountOut(in.subtract(BigInteger.TWO), rIn, rOut, 30))
                    .isLessThan(wanted);
        }

        @Test
        @DisplayName("Requesting the whole output reserve throws InsufficientLiquidityException")
        void wholeReserve_throws() {
            BigInteger r = BigInteger.valueOf(1_000);

            assertThatThrownBy(() -> ammCalculator.amountIn(r, r, r, 30))
                    .isInstanceOf(InsufficientLiquidityException.class);
        }

        @Test
        @DisplayName("Zero requested output yields zero")
        void zeroOutput_returnsZero() {
            BigInteger r = BigInteger.valueOf(1_000);
            assertThat(ammCalculator.amountIn(BigInteger.ZERO, r, r, 30)).isZero();
        }
    }

    // ==============================
    // PROPERTIES OVER RESERVES AND SIZES
    // ==============================

    @Nested
    @DisplayName("Properties across reserves and sizes")
    class Properties {

        @ParameterizedTest(name = "reserves {0}/{1}, fee {2}")
        @MethodSource("com.arbtrader.unit.amm.AmmCalculatorTest#pools")
        @DisplayName("Quoting the output of x back brackets x within one output unit")
        void roundTrip_bracketsInput(BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
            for (BigInteger x : inputSizes(reserveIn)) {
                BigInteger out = ammCalculator.amountOut(x, reserveIn, reserveOut, feeBps);
                if (out.signum() == 0 || out.add(BigInteger.ONE).compareTo(reserveOut) >= 0) {
                    continue;
                }

                BigInteger quoted = ammCalculator.amountIn(out, reserveIn, reserveOut, feeBps);

                assertThat(quoted).as("amountIn(amountOut(%s))", x).isLessThanOrEqualTo(x.add(BigInteger.ONE));
                assertThat(ammCalculator.amountIn(out.add(BigInteger.ONE), reserveIn, reserveOut, feeBps))
                        .as("amountIn(amountOut(%s) + 1)", x)
                        .isGreaterThan(x);
                assertThat(ammCalculator.amountOut(quoted, reserveIn, reserveOut, feeBps))
                        .as("amountOut(amountIn(%s))", out)
                        .isGreaterThanOrEqualTo(out);
            }
        }

        @ParameterizedTest(name = "reserves {0}/{1}, fee {2}")
        @MethodSource("com.arbtrader.unit.amm.AmmCalculatorTest#pools")
        @DisplayName("amountOut and price impact never decrease as the input grows")
        void amountOutAndImpact_nonDecreasing(BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
            BigInteger previousOut = BigInteger.ZERO;
            double previousImpact = 0.0;
            for (BigInteger x : inputSizes(reserveIn)) {
                BigInteger out = ammCalculator.amountOut(x, reserveIn, reserveOut, feeBps);
                double impact = ammCalculator.priceImpactPct(x, reserveIn, reserveOut, feeBps);

                assertThat(out).as("amountOut(%s)", x).isGreaterThanOrEqualTo(previousOut);
                assertThat(out).as("amountOut(%s)", x).isLessThan(reserveOut);
                assertThat(impact).as("priceImpactPct(%s)", x).isGreaterThanOrEqualTo(previousImpact);
                previousOut = out;
                previousImpact = impact;
            }
        }
    }

    // ==============================
    // SIMULATION & OPTIMAL SIZE
    // ==============================

    @Nested
    @DisplayName("Route simulation and optimal size")
    class SimulationAndOptimalSize {

        private final ReservePair venueA =
                ReservePair.of(BigInteger.valueOf(1_000_000).multiply(E6), BigInteger.valueOf(500).multiply(E18), 30);
        private final ReservePair venueB =
                ReservePair.of(BigInteger.valueOf(510).multiply(E18), BigInteger.valueOf(1_000_000).multiply(E6), 30);

        @Test
        @DisplayName("simulateRoute folds amountOut leg by leg")
        void simulate_foldsLegs() {
            BigInteger in = BigInteger.valueOf(1_000).multiply(E6);

            List<BigInteger> outs = ammCalculator.simulateRoute(in, List.of(venueA, venueB));

            assertThat(outs).hasSize(2);
            assertThat(outs.get(0)).isEqualTo(ammCalculator.amountOut(in, venueA));
            assertThat(outs.get(1)).isEqualTo(ammCalculator.amountOut(outs.get(0), venueB));
        }

        @Test
        @DisplayName("No profitable amount returns zero")
        void unprofitable_returnsZero() {
            ReservePair same = ReservePair.of(BigInteger.valueOf(1_000_000), BigInteger.valueOf(1_000_000), 30);

            assertThat(ammCalculator.optimalAmount(same, same, BigInteger.valueOf(100_000), 50))
                    .isZero();
        }

        @Test
        @DisplayName("Finds a profitable amount when the venues disagree")
        void mispricedVenues_findProfitableAmount() {
            // WETH is cheaper on B: sell USDC for WETH on B, sell the WETH back on A
            ReservePair buyOnB =
                    ReservePair.of(BigInteger.valueOf(1_000_000).multiply(E6), BigInteger.valueOf(510).multiply(E18), 30);
            ReservePair sellOnA =
                    ReservePair.of(BigInteger.valueOf(500).multiply(E18), BigInteger.valueOf(1_000_000).multiply(E6), 30);
            BigInteger max = BigInteger.valueOf(100_000).multiply(E6);

            BigInteger best = ammCalculator.optimalAmount(buyOnB, sellOnA, max, 60);

            assertThat(best).isPositive().isLessThanOrEqualTo(max);
            List<BigInteger> outs = ammCalculator.simulateRoute(best, List.of(buyOnB, sellOnA));
            assertThat(outs.get(1)).isGreaterThan(best);
        }

        @Test
        @DisplayName("More iterations never yield a worse profit")
        void moreIterations_neverWorse() {
            ReservePair buyOnB =
                    ReservePair.of(BigInteger.valueOf(1_000_000).multiply(E6), BigInteger.valueOf(510).multiply(E18), 30);
            ReservePair sellOnA =
                    ReservePair.of(BigInteger.valueOf(500).multiply(E18), BigInteger.valueOf(1_000_000).multiply(E6), 30);
            BigInteger max = BigInteger.valueOf(100_000).multiply(E6);

            BigInteger coarse = ammCalculator.optimalAmount(buyOnB, sellOnA, max, 5);
            BigInteger fine = ammCalculator.optimalAmount(buyOnB, sellOnA, max, 60);

            assertThat(profit(fine, buyOnB, sellOnA)).isGreaterThanOrEqualTo(profit(coarse, buyOnB, sellOnA));
        }

        private BigInteger profit(BigInteger amount, ReservePair first, ReservePair second) {
            List<BigInteger> outs = ammCalculator.simulateRoute(amount, List.of(first, second));
            return outs.get(1).subtract(amount);
        }
    }

    // ==============================
    // PRICE HELPERS
    // ==============================

    @Nested
    @DisplayName("Price helpers")
    class PriceHelpers {

        @Test
        @DisplayName("midPrice is reserveOut / reserveIn and 0 for an empty pool")
        void midPrice() {
            assertThat(ammCalculator.midPrice(BigInteger.valueOf(2), BigInteger.valueOf(6)))
                    .isEqualTo(3.0);
            assertThat(ammCalculator.midPrice(BigInteger.ZERO, BigInteger.valueOf(6)))
                    .isZero();
        }

        @Test
        @DisplayName("Price impact is non-negative and grows with trade size")
        void priceImpact_monotonic() {
            BigInteger rIn = BigInteger.valueOf(1_000_000).multiply(E6);
            BigInteger rOut = BigInteger.valueOf(500).multiply(E18);

            double small = ammCalculator.priceImpactPct(BigInteger.valueOf(100).multiply(E6), rIn, rOut, 30);
            double medium = ammCalculator.priceImpactPct(BigInteger.valueOf(10_000).multiply(E6), rIn, rOut, 30);
            double large = ammCalculator.priceImpactPct(BigInteger.valueOf(100_000).multiply(E6), rIn, rOut, 30);

            assertThat(small).isGreaterThanOrEqualTo(0.0);
            assertThat(medium).isGreaterThan(small);
            assertThat(large).isGreaterThan(medium);
        }

        @Test
        @DisplayName("Two-price spread is relative to the average")
        void twoPriceSpread() {
            assertThat(ammCalculator.spreadBps(99.0, 101.0)).isCloseTo(200.0, offset(1e-9));
            assertThat(ammCalculator.spreadBps(0.0, 0.0)).isZero();
        }

        @Test
        @DisplayName("Triangular spread measures deviation of the composite price from parity")
        void triangularSpread() {
            assertThat(ammCalculator.spreadBps(2.0, 0.5, 1.01))
                    .isCloseTo(100.0, offset(1e-6));
        }
    }
}
