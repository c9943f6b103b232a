package com.arbtrader.config;

import com.arbtrader.domain.model.Route;
import com.arbtrader.domain.model.TokenInfo;
import com.arbtrader.domain.model.TokenRegistry;
import com.arbtrader.domain.model.VenueInfo;
import com.arbtrader.engine.OrchestratorSettings;
import com.arbtrader.engine.RouteGenerator;
import com.arbtrader.exception.InvalidConfigurationException;
import com.arbtrader.profit.GasSettings;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Arbitrage engine configuration, bound to the {@code arbtrader.*} prefix.
 *
 * <p>Provides the token and venue registries, the route set (generated once here, so a
 * bad token or venue list fails startup), the orchestrator and gas settings, and the
 * UTC {@link Clock} every time-dependent component reads.
 */
@Configuration
@ConfigurationProperties(prefix = "arbtrader")
@Getter
@Setter
public class ArbitrageConfig {

    /** {@code paper} journals and self-records candidates; {@code live} leaves them to an external executor. */
    private String mode = "paper";

    private List<Token> tokens = new ArrayList<>();

    /** Exactly two venues: routes buy on the first and sell on the second. */
    private List<Venue> venues = new ArrayList<>();

    private Routes routes = new Routes();

    private List<BigDecimal> candidateSizesUsd =
            List.of(new BigDecimal("100"), new BigDecimal("250"), new BigDecimal("500"), new BigDecimal("1000"));

    private BigDecimal minProfitUsd = new BigDecimal("1.00");

    private int slippageBps = 50;

    private double confidenceThreshold = 0.5;

    private Gas gas = new Gas();

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenRegistry tokenRegistry() {
        List<TokenInfo> tokenInfos = new ArrayList<>();
        for (Token token : tokens) {
            if (token.getUsdPrice() == null || token.getUsdPrice().signum() <= 0) {
                throw new InvalidConfigurationException("Token " + token.getSymbol() + " needs a positive usd-price");
            }
            tokenInfos.add(TokenInfo.builder()
                    .symbol(token.getSymbol())
                    .address(token.getAddress())
                    .decimals(token.getDecimals())
                    .usdPrice(token.getUsdPrice())
                    .build());
        }
        return new TokenRegistry(tokenInfos);
    }

    @Bean
    public List<VenueInfo> venueInfos() {
        if (venues.size() != 2) {
            throw new InvalidConfigurationException("Exactly two venues must be configured, got " + venues.size());
        }
        List<VenueInfo> venueInfos = new ArrayList<>();
        for (Venue venue : venues) {
            if (venue.getFeeBps() < 0 || venue.getFeeBps() >= 10_000) {
                throw new InvalidConfigurationException(
                        "Venue " + venue.getName() + " fee out of range: " + venue.getFeeBps());
            }
            venueInfos.add(VenueInfo.builder()
                    .name(venue.getName())
                    .factoryAddress(venue.getFactoryAddress())
                    .feeBps(venue.getFeeBps())
                    .build());
        }
        return List.copyOf(venueInfos);
    }

    @Bean
    public List<Route> arbitrageRoutes(RouteGenerator routeGenerator) {
        List<String> symbols = tokens.stream().map(Token::getSymbol).toList();
        return routeGenerator.generate(
                symbols,
                venueInfos().get(0).getName(),
                venueInfos().get(1).getName(),
                routes.isTriangular(),
                routes.isCrossVenue());
    }

    @Bean
    public OrchestratorSettings orchestratorSettings() {
        List<BigDecimal> sizes = new ArrayList<>(candidateSizesUsd);
        sizes.sort(null);
        return OrchestratorSettings.builder()
                .candidateSizesUsd(List.copyOf(sizes))
                .minProfitUsd(minProfitUsd)
                .slippageBps(slippageBps)
                .confidenceThreshold(confidenceThreshold)
                .evaluationTimeoutMs(routes.getEvaluationTimeoutMs())
                .build();
    }

    @Bean
    public GasSettings gasSettings() {
        return GasSettings.builder()
                .baseGasLimit(gas.getBaseGasLimit())
                .gasLimitMultiplier(gas.getGasLimitMultiplier())
                .priceMultiplier(gas.getPriceMultiplier())
                .nativeTokenUsd(gas.getNativeTokenUsd())
                .oracleTimeoutMs(gas.getOracleTimeoutMs())
                .fallbackCostUsd(gas.getFallbackCostUsd())
                .build();
    }

    @Getter
    @Setter
    public static class Token {

        private String symbol;

        private String address;

        private int decimals = 18;

        /** Reference USD price for notional and profit conversion. */
        private BigDecimal usdPrice;
    }

    @Getter
    @Setter
    public static class Venue {

        private String name;

        /** Pair factory contract. */
        private String factoryAddress;

        private int feeBps = 30;
    }

    @Getter
    @Setter
    public static class Routes {

        private boolean triangular = true;

        private boolean crossVenue = true;

        /** Bounded wait for all routes of one market update. */
        private long evaluationTimeoutMs = 2000;
    }

    @Getter
    @Setter
    public static class Gas {

        private long baseGasLimit = 250_000L;

        private double gasLimitMultiplier = 1.2;

        private double priceMultiplier = 1.1;

        /** USD price of the chain's native token. */
        private BigDecimal nativeTokenUsd = new BigDecimal("0.50");

        private long oracleTimeoutMs = 1500;

        /** Gas cost assumed when the fee oracle is unavailable. */
        private BigDecimal fallbackCostUsd = new BigDecimal("40");
    }
}
