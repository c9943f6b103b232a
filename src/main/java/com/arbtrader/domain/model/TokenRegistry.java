package com.arbtrader.domain.model;

import com.arbtrader.exception.DataUnavailableException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configured tokens by symbol, with USD and base-unit conversions at each token's
 * reference price. Immutable after construction.
 */
public class TokenRegistry {

    private static final int USD_SCALE = 6;

    private final Map<String, TokenInfo> tokens;

    public TokenRegistry(List<TokenInfo> tokens) {
        Map<String, TokenInfo> bySymbol = new LinkedHashMap<>();
        for (TokenInfo token : tokens) {
            bySymbol.put(token.getSymbol(), token);
        }
        this.tokens = Map.copyOf(bySymbol);
    }

    /** @throws DataUnavailableException if the symbol is not configured */
    public TokenInfo get(String symbol) {
        TokenInfo token = tokens.get(symbol);
        if (token == null) {
            throw new DataUnavailableException("No token configuration for " + symbol);
        }
        return token;
    }

    public Collection<TokenInfo> all() {
        return tokens.values();
    }

    /** USD amount to base units, rounded down. */
    public BigInteger toBaseUnits(String symbol, BigDecimal usd) {
        return toBaseUnits(symbol, usd, RoundingMode.FLOOR);
    }

    public BigInteger toBaseUnits(String symbol, BigDecimal usd, RoundingMode roundingMode) {
        TokenInfo token = get(symbol);
        return usd.divide(token.getUsdPrice(), token.getDecimals() + USD_SCALE, RoundingMode.HALF_EVEN)
                .movePointRight(token.getDecimals())
                .setScale(0, roundingMode)
                .toBigIntegerExact();
    }

    /** Base units to USD at 6 decimals, rounded toward negative infinity so a loss never reads as zero. */
    public BigDecimal toUsd(String symbol, BigInteger baseUnits) {
        TokenInfo token = get(symbol);
        return new BigDecimal(baseUnits)
                .movePointLeft(token.getDecimals())
                .multiply(token.getUsdPrice())
                .setScale(USD_SCALE, RoundingMode.FLOOR);
    }
}
