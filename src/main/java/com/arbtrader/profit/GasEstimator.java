package com.arbtrader.profit;

import com.arbtrader.connector.FeeOracle;
import com.arbtrader.domain.model.GasEstimate;
import com.arbtrader.observability.ArbitrageMetrics;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Prices the gas of an arbitrage transaction in USD.
 *
 * <p>The fee oracle is queried on the event executor with a bounded wait. Any failure,
 * timeout or empty answer falls back to a fixed conservative estimate
 * (400000 gas at 50 gwei, priced at {@code fallbackCostUsd}) flagged {@code fallback=true}; the
 * failure is logged and counted, never propagated to the caller.
 */
@Component
public class GasEstimator {

    private static final Logger log = LoggerFactory.getLogger(GasEstimator.class);

    static final BigInteger FALLBACK_GAS_LIMIT = BigInteger.valueOf(400_000L);
    static final BigInteger FALLBACK_GAS_PRICE_WEI = BigInteger.valueOf(50_000_000_000L);

    private static final BigDecimal WEI_PER_NATIVE = new BigDecimal("1000000000000000000");

    private final FeeOracle feeOracle;
    private final GasSettings gasSettings;
    private final ArbitrageMetrics arbitrageMetrics;
    private final Executor executor;

    public GasEstimator(
            FeeOracle feeOracle,
            GasSettings gasSettings,
            ArbitrageMetrics arbitrageMetrics,
            @Qualifier("eventExecutor") Executor executor) {
        this.feeOracle = feeOracle;
        this.gasSettings = gasSettings;
        this.arbitrageMetrics = arbitrageMetrics;
        this.executor = executor;
    }

    public GasEstimate estimate() {
        Optional<BigInteger> oraclePrice = queryOracle();
        if (oraclePrice.isEmpty() || oraclePrice.get().signum() <= 0) {
            arbitrageMetrics.recordGasFallback();
            return fallback();
        }

        BigInteger gasLimit = BigInteger.valueOf(
                Math.round(gasSettings.getBaseGasLimit() * gasSettings.getGasLimitMultiplier()));
        BigInteger gasPriceWei = new BigDecimal(oraclePrice.get())
                .multiply(BigDecimal.valueOf(gasSettings.getPriceMultiplier()))
                .setScale(0, RoundingMode.CEILING)
                .toBigIntegerExact();

        return GasEstimate.builder()
                .gasLimit(gasLimit)
                .gasPriceWei(gasPriceWei)
                .costUsd(costUsd(gasLimit, gasPriceWei))
                .fallback(false)
                .build();
    }

    /** {@code gasLimit * gasPriceWei / 1e18 * nativeTokenUsd}. */
    public BigDecimal costUsd(BigInteger gasLimit, BigInteger gasPriceWei) {
        BigDecimal nativeCost = new BigDecimal(gasPriceWei.multiply(gasLimit))
                .divide(WEI_PER_NATIVE, 18, RoundingMode.HALF_UP);
        return nativeCost.multiply(gasSettings.getNativeTokenUsd()).setScale(8, RoundingMode.HALF_UP);
    }

    private Optional<BigInteger> queryOracle() {
        try {
            return CompletableFuture.supplyAsync(feeOracle::currentGasPriceWei, executor)
                    .get(gasSettings.getOracleTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn(
                    "Fee oracle did not answer within {}ms, using fallback gas estimate",
                    gasSettings.getOracleTimeoutMs());
        } catch (ExecutionException e) {
            log.warn("Fee oracle query failed, using fallback gas estimate: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for fee oracle, using fallback gas estimate");
        }
        return Optional.empty();
    }

    private GasEstimate fallback() {
        log.warn(
                "Using fallback gas estimate: {} gas at {} wei, {} USD",
                FALLBACK_GAS_LIMIT,
                FALLBACK_GAS_PRICE_WEI,
                gasSettings.getFallbackCostUsd());
        return GasEstimate.builder()
                .gasLimit(FALLBACK_GAS_LIMIT)
                .gasPriceWei(FALLBACK_GAS_PRICE_WEI)
                .costUsd(gasSettings.getFallbackCostUsd())
                .fallback(true)
                .build();
    }
}
