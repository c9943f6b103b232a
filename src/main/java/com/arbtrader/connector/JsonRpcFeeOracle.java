package com.arbtrader.connector;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link FeeOracle} backed by the chain's JSON-RPC endpoint ({@code eth_gasPrice}).
 *
 * <p>Retries transient failures and trips a circuit breaker when the node keeps failing;
 * once the breaker is open, calls return empty immediately so the GasEstimator switches
 * to its conservative fallback without waiting on the network. The RestClient bean
 * carries the connect/read timeouts (see RpcConfig).
 */
@Service
public class JsonRpcFeeOracle implements FeeOracle {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcFeeOracle.class);

    private final JsonRpcClient jsonRpcClient;

    public JsonRpcFeeOracle(JsonRpcClient jsonRpcClient) {
        this.jsonRpcClient = jsonRpcClient;
    }

    @Override
    @CircuitBreaker(name = "feeOracle", fallbackMethod = "unavailable")
    @Retry(name = "feeOracle")
    public Optional<BigInteger> currentGasPriceWei() {
        return Optional.of(JsonRpcClient.parseQuantity(jsonRpcClient.call("eth_gasPrice", List.of())));
    }

    private Optional<BigInteger> unavailable(Throwable cause) {
        log.warn("Fee oracle unavailable: {}", cause.getMessage());
        return Optional.empty();
    }
}
