package com.arbtrader.connector;

import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.domain.model.TokenInfo;
import com.arbtrader.domain.model.TokenRegistry;
import com.arbtrader.domain.model.VenueInfo;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link ReserveReader} that reads Uniswap-V2 style pairs over JSON-RPC.
 *
 * <p>The pair address comes from the venue factory's {@code getPair(tokenA, tokenB)} and
 * is cached; a zero address means the venue has no pool for the pair. Reserves come from
 * {@code getReserves()} and are oriented to the requested direction using {@code token0()}.
 */
@Service
public class JsonRpcReserveReader implements ReserveReader {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcReserveReader.class);

    static final String GET_PAIR_SELECTOR = "0xe6a43905";
    static final String GET_RESERVES_SELECTOR = "0x0902f1ac";
    static final String TOKEN0_SELECTOR = "0x0dfe1681";

    private static final String NO_PAIR = "";

    private final JsonRpcClient jsonRpcClient;
    private final TokenRegistry tokenRegistry;
    private final Map<String, VenueInfo> venues;
    private final Map<String, String> pairCache = new ConcurrentHashMap<>();

    public JsonRpcReserveReader(JsonRpcClient jsonRpcClient, TokenRegistry tokenRegistry, List<VenueInfo> venues) {
        this.jsonRpcClient = jsonRpcClient;
        this.tokenRegistry = tokenRegistry;
        Map<String, VenueInfo> byName = new ConcurrentHashMap<>();
        for (VenueInfo venue : venues) {
            byName.put(venue.getName(), venue);
        }
        this.venues = byName;
    }

    @Override
    @CircuitBreaker(name = "reserveReader", fallbackMethod = "unavailable")
    @Retry(name = "reserveReader")
    public Optional<ReservePair> getReserves(String tokenIn, String tokenOut, String venue) {
        VenueInfo venueInfo = venues.get(venue);
        if (venueInfo == null) {
            log.warn("Unknown venue {}", venue);
            return Optional.empty();
        }
        TokenInfo in = tokenRegistry.get(tokenIn);
        TokenInfo out = tokenRegistry.get(tokenOut);

        String pair = pairAddress(venueInfo, in, out);
        if (pair.equals(NO_PAIR)) {
            return Optional.empty();
        }

        String[] reserves = JsonRpcClient.abiWords(jsonRpcClient.ethCall(pair, GET_RESERVES_SELECTOR), 2);
        BigInteger reserve0 = new BigInteger(reserves[0], 16);
        BigInteger reserve1 = new BigInteger(reserves[1], 16);

        String token0 = wordToAddress(JsonRpcClient.abiWords(jsonRpcClient.ethCall(pair, TOKEN0_SELECTOR), 1)[0]);
        boolean inIsToken0 = token0.equals(normalize(in.getAddress()));

        return Optional.of(inIsToken0
                ? ReservePair.of(reserve0, reserve1, venueInfo.getFeeBps())
                : ReservePair.of(reserve1, reserve0, venueInfo.getFeeBps()));
    }

    private Optional<ReservePair> unavailable(String tokenIn, String tokenOut, String venue, Throwable cause) {
        log.warn("Reserves unavailable for {}->{}@{}: {}", tokenIn, tokenOut, venue, cause.getMessage());
        return Optional.empty();
    }

    private String pairAddress(VenueInfo venue, TokenInfo a, TokenInfo b) {
        String key = venue.getName() + ":" + a.getSymbol() + ":" + b.getSymbol();
        String cached = pairCache.get(key);
        if (cached != null) {
            return cached;
        }
        String data = GET_PAIR_SELECTOR + pad(a.getAddress()) + pad(b.getAddress());
        String pair = wordToAddress(JsonRpcClient.abiWords(jsonRpcClient.ethCall(venue.getFactoryAddress(), data), 1)[0]);
        if (new BigInteger(pair.substring(2), 16).signum() == 0) {
            log.info("No {} pool for {}/{}", venue.getName(), a.getSymbol(), b.getSymbol());
            pair = NO_PAIR;
        }
        pairCache.put(key, pair);
        return pair;
    }

    static String pad(String address) {
        String hex = normalize(address).substring(2);
        return "0".repeat(64 - hex.length()) + hex;
    }

    static String wordToAddress(String word) {
        return "0x" + word.substring(word.length() - 40).toLowerCase(Locale.ROOT);
    }

    private static String normalize(String address) {
        return address.toLowerCase(Locale.ROOT);
    }
}
