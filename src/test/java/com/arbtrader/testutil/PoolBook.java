package com.arbtrader.testutil;

import com.arbtrader.connector.ReserveReader;
import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.domain.model.TokenInfo;
import com.arbtrader.domain.model.TokenRegistry;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory USDC/WETH pools per venue, oriented on request like an on-chain reader.
 *
 * <p>The default book prices WETH at 2000 USDC on quickswap and about 1961 USDC on
 * sushiswap, which makes selling WETH on quickswap and buying it back on sushiswap profitable.
 */
public class PoolBook implements ReserveReader {

    public static final String QUICKSWAP = "quickswap";
    public static final String SUSHISWAP = "sushiswap";

    public static final BigInteger ONE_MILLION_USDC = new BigInteger("1000000000000");
    public static final BigInteger WETH_500 = new BigInteger("500000000000000000000");
    public static final BigInteger WETH_510 = new BigInteger("510000000000000000000");

    private final Map<String, BigInteger[]> pools = new HashMap<>();
    private final Set<String> failingLegs = new HashSet<>();
    private final AtomicInteger reads = new AtomicInteger();

    public static PoolBook divergent() {
        return new PoolBook()
                .withPool(QUICKSWAP, ONE_MILLION_USDC, WETH_500)
                .withPool(SUSHISWAP, ONE_MILLION_USDC, WETH_510);
    }

    public static TokenRegistry tokenRegistry() {
        return new TokenRegistry(List.of(
                TokenInfo.builder()
                        .symbol("USDC")
                        .address("0x2791bca1f2de4661ed88a30c99a7a9449aa84174")
                        .decimals(6)
                        .usdPrice(BigDecimal.ONE)
                        .build(),
                TokenInfo.builder()
                        .symbol("WETH")
                        .address("0x7ceb23fd6bc0add59e62ac25578270cff1b9f619")
                        .decimals(18)
                        .usdPrice(new BigDecimal("2000"))
                        .build()));
    }

    public PoolBook withPool(String venue, BigInteger usdcReserve, BigInteger wethReserve) {
        pools.put(venue, new BigInteger[] {usdcReserve, wethReserve});
        return this;
    }

    /** Reading this leg throws, as an RPC failure would. */
    public PoolBook failing(String tokenIn, String tokenOut, String venue) {
        failingLegs.add(tokenIn + "->" + tokenOut + "@" + venue);
        return this;
    }

    public int getReads() {
        return reads.get();
    }

    @Override
    public Optional<ReservePair> getReserves(String tokenIn, String tokenOut, String venue) {
        reads.incrementAndGet();
        if (failingLegs.contains(tokenIn + "->" + tokenOut + "@" + venue)) {
            throw new IllegalStateException("RPC error reading " + venue);
        }
        BigInteger[] pool = pools.get(venue);
        if (pool == null) {
            return Optional.empty();
        }
        return "USDC".equals(tokenIn)
                ? Optional.of(ReservePair.of(pool[0], pool[1], 30))
                : Optional.of(ReservePair.of(pool[1], pool[0], 30));
    }
}
