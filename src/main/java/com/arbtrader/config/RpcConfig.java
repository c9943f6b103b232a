package com.arbtrader.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Chain node connection settings, bound to {@code arbtrader.rpc.*}.
 *
 * <p>Provides the {@link RestClient} used by the JSON-RPC adapters (fee oracle and
 * reserve reader). Retry and circuit breaker settings for those adapters live under
 * {@code resilience4j.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "arbtrader.rpc")
@Getter
@Setter
public class RpcConfig {

    private static final Logger log = LoggerFactory.getLogger(RpcConfig.class);

    /** JSON-RPC endpoint of the chain node. */
    private String url = "http://localhost:8545";

    /** HTTP connect timeout in milliseconds. */
    private int connectTimeout = 2000;

    /** HTTP read timeout in milliseconds. */
    private int readTimeout = 3000;

    @Bean
    public RestClient rpcRestClient() {
        log.info("Creating JSON-RPC client for {}", url);
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        return RestClient.builder()
                .baseUrl(url)
                .requestFactory(requestFactory)
                .build();
    }
}
