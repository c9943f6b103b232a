package com.arbtrader.unit.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.arbtrader.connector.JsonRpcClient;
import com.arbtrader.connector.JsonRpcFeeOracle;
import com.arbtrader.exception.DataUnavailableException;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for JsonRpcFeeOracle. Retry and circuit breaking are applied by the
 * resilience4j aspects at runtime and are not active here.
 */
@ExtendWith(MockitoExtension.class)
class JsonRpcFeeOracleTest {

    @Mock
    private JsonRpcClient jsonRpcClient;

    @InjectMocks
    private JsonRpcFeeOracle feeOracle;

    @Test
    @DisplayName("Returns the node's gas price in wei")
    void gasPrice() {
        when(jsonRpcClient.call("eth_gasPrice", List.of())).thenReturn("0x6fc23ac00");

        assertThat(feeOracle.currentGasPriceWei()).contains(BigInteger.valueOf(30_000_000_000L));
    }

    @Test
    @DisplayName("Node failures propagate to the resilience layer")
    void nodeFailure() {
        when(jsonRpcClient.call("eth_gasPrice", List.of())).thenThrow(new DataUnavailableException("timeout"));

        assertThatThrownBy(() -> feeOracle.currentGasPriceWei()).isInstanceOf(DataUnavailableException.class);
    }
}
