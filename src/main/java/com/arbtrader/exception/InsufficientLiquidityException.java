package com.arbtrader.exception;

import java.math.BigInteger;
import java.util.Map;

/**
 * Thrown by {@code AmmCalculator.amountIn} when the requested output is not strictly
 * below the pool's output reserve.
 */
public class InsufficientLiquidityException extends BaseException {

    public InsufficientLiquidityException(BigInteger amountOut, BigInteger reserveOut) {
        super(
                ErrorCode.INSUFFICIENT_LIQUIDITY,
                "Insufficient liquidity: requested " + amountOut + " but reserve is " + reserveOut,
                Map.of("amountOut", amountOut.toString(), "reserveOut", reserveOut.toString()));
    }
}
