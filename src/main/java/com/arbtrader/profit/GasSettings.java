package com.arbtrader.profit;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Gas model parameters. {@code gasLimit = baseGasLimit * gasLimitMultiplier} and
 * {@code gasPrice = oraclePrice * priceMultiplier}; the multipliers add headroom
 * for inclusion.
 */
@Value
@Builder
public class GasSettings {

    long baseGasLimit;
    double gasLimitMultiplier;
    double priceMultiplier;

    /** USD price of the chain's native token, used to price gas. */
    BigDecimal nativeTokenUsd;

    /** Upper bound on the fee oracle query. */
    long oracleTimeoutMs;

    /** USD cost charged when the oracle gives no price. */
    @Builder.Default
    BigDecimal fallbackCostUsd = new BigDecimal("40");
}
