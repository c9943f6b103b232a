package com.arbtrader.amm;

import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.exception.InsufficientLiquidityException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Constant-product (x * y = k) swap arithmetic for Uniswap-V2 style pools.
 *
 * <p>Everything on the accounting path ({@link #amountOut}, {@link #amountIn},
 * {@link #simulateRoute}, {@link #optimalAmount}) is exact {@link BigInteger} arithmetic with
 * floor division, matching what the pool contract computes on chain. The double-valued
 * methods ({@link #midPrice}, {@link #priceImpactPct}, the spread helpers) are for
 * magnitude comparisons and features only and must never feed a profit figure.
 *
 * <p>Fees are taken from the input amount:
 * <pre>
 *   effIn = amountIn * (10000 - feeBps)
 *   out   = floor(effIn * reserveOut / (reserveIn * 10000 + effIn))
 * </pre>
 *
 * <p>Stateless and thread-safe.
 */
@Component
public class AmmCalculator {

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    // ========================
    // SWAP ARITHMETIC
    // ========================

    /**
     * Output amount for selling {@code amountIn} into the pool. Returns 0 if any operand is 0.
     * The result is always strictly below {@code reserveOut}.
     */
    public BigInteger amountOut(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        if (amountIn.signum() == 0 || reserveIn.signum() == 0 || reserveOut.signum() == 0) {
            return BigInteger.ZERO;
        }
        BigInteger amountInWithFee = amountIn.multiply(BigInteger.valueOf(10_000L - feeBps));
        BigInteger numerator = amountInWithFee.multiply(reserveOut);
        BigInteger denominator = reserveIn.multiply(BPS).add(amountInWithFee);
        return numerator.divide(denominator);
    }

    public BigInteger amountOut(BigInteger amountIn, ReservePair pool) {
        return amountOut(amountIn, pool.getReserveIn(), pool.getReserveOut(), pool.getFeeBps());
    }

    /**
     * Input amount required to receive {@code amountOut}. Rounds up and adds one unit of
     * slack, so {@code amountOut(amountIn(x)) >= x}. Returns 0 if any operand is 0.
     *
     * @throws InsufficientLiquidityException if {@code amountOut >= reserveOut}
     */
    public BigInteger amountIn(BigInteger amountOut, BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        if (amountOut.signum() == 0 || reserveIn.signum() == 0 || reserveOut.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (amountOut.compareTo(reserveOut) >= 0) {
            throw new InsufficientLiquidityException(amountOut, reserveOut);
        }
        BigInteger numerator = reserveIn.multiply(amountOut).multiply(BPS);
        BigInteger denominator = reserveOut.subtract(amountOut).multiply(BigInteger.valueOf(10_000L - feeBps));
        return numerator.divide(denominator).add(BigInteger.ONE);
    }

    public BigInteger amountIn(BigInteger amountOut, ReservePair pool) {
        return amountIn(amountOut, pool.getReserveIn(), pool.getReserveOut(), pool.getFeeBps());
    }

    /**
     * Folds {@link #amountOut} across the legs of a route in order.
     *
     * @return the output of every leg; the last element is the amount returned to the start token
     */
    public List<BigInteger> simulateRoute(BigInteger amountIn, List<ReservePair> legs) {
        List<BigInteger> outputs = new ArrayList<>(legs.size());
        BigInteger carried = amountIn;
        for (ReservePair leg : legs) {
            carried = amountOut(carried, leg);
            outputs.add(carried);
        }
        return outputs;
    }

    // ========================
    // OPTIMAL SIZE SEARCH
    // ========================

    /**
     * Searches {@code [0, maxAmount]} for the input maximizing the two-hop profit
     * X -> Y on {@code firstLeg}, Y -> X on {@code secondLeg}.
     *
     * <p>The constant-product profit curve is concave, so the search halves the interval
     * on the sign of the local slope, sampled over a step of 1/1000 of the remaining
     * interval (a single-unit step is dominated by floor rounding). The best profitable
     * point seen is returned; since a longer search only visits more points, more
     * iterations never yield a worse amount. Returns 0 when no probed amount is profitable.
     */
    public BigInteger optimalAmount(ReservePair firstLeg, ReservePair secondLeg, BigInteger maxAmount, int iterations) {
        BigInteger low = BigInteger.ZERO;
        BigInteger high = maxAmount;
        BigInteger bestAmount = BigInteger.ZERO;
        BigInteger bestProfit = BigInteger.ZERO;

        for (int i = 0; i < iterations && low.compareTo(high) < 0; i++) {
            BigInteger mid = low.add(high).shiftRight(1);
            BigInteger step = high.subtract(low).divide(BigInteger.valueOf(1000)).max(BigInteger.ONE);
            BigInteger probe = mid.add(step).min(high);

            BigInteger midProfit = twoHopProfit(mid, firstLeg, secondLeg);
            BigInteger probeProfit = twoHopProfit(probe, firstLeg, secondLeg);

            if (midProfit.compareTo(bestProfit) > 0) {
                bestProfit = midProfit;
                bestAmount = mid;
            }
            if (probeProfit.compareTo(bestProfit) > 0) {
                bestProfit = probeProfit;
                bestAmount = probe;
            }

            if (probeProfit.compareTo(midProfit) > 0) {
                low = probe;
            } else {
                high = mid;
            }
        }
        return bestAmount;
    }

    /** Signed round-trip profit of selling {@code amount} through both legs. */
    BigInteger twoHopProfit(BigInteger amount, ReservePair firstLeg, ReservePair secondLeg) {
        BigInteger intermediate = amountOut(amount, firstLeg);
        BigInteger back = amountOut(intermediate, secondLeg);
        return back.subtract(amount);
    }

    // ========================
    // PRICE HELPERS (magnitude only)
    // ========================

    /** Marginal price of the input token in output-token units; 0 if either reserve is 0. */
    public double midPrice(BigInteger reserveIn, BigInteger reserveOut) {
        if (reserveIn.signum() == 0 || reserveOut.signum() == 0) {
            return 0.0;
        }
        return reserveOut.doubleValue() / reserveIn.doubleValue();
    }

    public double midPrice(ReservePair pool) {
        return midPrice(pool.getReserveIn(), pool.getReserveOut());
    }

    /**
     * Magnitude, in percent, of the move in the pool's marginal price caused by selling
     * {@code amountIn}. Non-decreasing in {@code amountIn}. Returns 0 for an empty pool
     * or a zero trade.
     */
    public double priceImpactPct(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        double priceBefore = midPrice(reserveIn, reserveOut);
        if (priceBefore == 0.0 || amountIn.signum() == 0) {
            return 0.0;
        }
        BigInteger out = amountOut(amountIn, reserveIn, reserveOut, feeBps);
        double priceAfter = midPrice(reserveIn.add(amountIn), reserveOut.subtract(out));
        return Math.abs((priceAfter - priceBefore) / priceBefore) * 100.0;
    }

    /** Relative price difference between two venues quoting the same pair, in bps. */
    public double spreadBps(double priceA, double priceB) {
        double average = (priceA + priceB) / 2.0;
        if (average == 0.0) {
            return 0.0;
        }
        return Math.abs(priceA - priceB) / average * 10_000.0;
    }

    /** Deviation of a triangular composite price from parity, in bps. */
    public double spreadBps(double priceAB, double priceBC, double priceCA) {
        return Math.abs(1.0 - priceAB * priceBC * priceCA) * 10_000.0;
    }

    /**
     * Deviation from parity of the product of mid prices around a closed loop of any
     * length, in bps. Zero when any leg's pool is empty.
     */
    public double compositeSpreadBps(List<ReservePair> legs) {
        double composite = 1.0;
        for (ReservePair leg : legs) {
            double price = midPrice(leg);
            if (price == 0.0) {
                return 0.0;
            }
            composite *= price;
        }
        return Math.abs(1.0 - composite) * 10_000.0;
    }
}
