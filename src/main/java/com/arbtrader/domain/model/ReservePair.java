package com.arbtrader.domain.model;

import java.math.BigInteger;
import lombok.Value;

/**
 * Snapshot of one constant-product pool, oriented in the direction of the swap:
 * {@code reserveIn} is the reserve of the token being sold, {@code reserveOut} the
 * reserve of the token being bought. Transient: lives for a single evaluation.
 */
@Value
public class ReservePair {

    BigInteger reserveIn;
    BigInteger reserveOut;

    /** Pool fee in basis points taken from the input amount (30 = 0.3%). */
    int feeBps;

    public ReservePair(BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        if (reserveIn == null || reserveOut == null) {
            throw new IllegalArgumentException("Reserves must not be null");
        }
        if (reserveIn.signum() < 0 || reserveOut.signum() < 0) {
            throw new IllegalArgumentException("Reserves must not be negative: " + reserveIn + "/" + reserveOut);
        }
        if (feeBps < 0 || feeBps >= 10_000) {
            throw new IllegalArgumentException("Fee must be in [0, 10000) bps: " + feeBps);
        }
        this.reserveIn = reserveIn;
        this.reserveOut = reserveOut;
        this.feeBps = feeBps;
    }

    public static ReservePair of(BigInteger reserveIn, BigInteger reserveOut, int feeBps) {
        return new ReservePair(reserveIn, reserveOut, feeBps);
    }

    /** The same pool seen from the opposite swap direction. */
    public ReservePair reversed() {
        return new ReservePair(reserveOut, reserveIn, feeBps);
    }
}
