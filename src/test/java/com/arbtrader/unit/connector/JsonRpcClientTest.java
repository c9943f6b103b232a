package com.arbtrader.unit.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.arbtrader.connector.JsonRpcClient;
import com.arbtrader.exception.DataUnavailableException;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/** Unit tests for JsonRpcClient against a mocked node. */
class JsonRpcClientTest {

    private MockRestServiceServer server;
    private JsonRpcClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://node.test/rpc");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new JsonRpcClient(builder.build());
    }

    @Nested
    @DisplayName("Calls")
    class Calls {

        @Test
        @DisplayName("Posts a JSON-RPC 2.0 request and returns the result")
        void call_returnsResult() {
            server.expect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.jsonrpc").value("2.0"))
                    .andExpect(jsonPath("$.method").value("eth_gasPrice"))
                    .andRespond(withSuccess(
                            "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x6fc23ac00\"}", MediaType.APPLICATION_JSON));

            String result = client.call("eth_gasPrice", List.of());

            assertThat(result).isEqualTo("0x6fc23ac00");
            server.verify();
        }

        @Test
        @DisplayName("eth_call targets the given contract at the latest block")
        void ethCall() {
            server.expect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.method").value("eth_call"))
                    .andExpect(jsonPath("$.params[0].to").value("0xpair"))
                    .andExpect(jsonPath("$.params[0].data").value("0x0902f1ac"))
                    .andExpect(jsonPath("$.params[1]").value("latest"))
                    .andRespond(withSuccess("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x01\"}", MediaType.APPLICATION_JSON));

            assertThat(client.ethCall("0xpair", "0x0902f1ac")).isEqualTo("0x01");
        }

        @Test
        @DisplayName("A node error becomes DataUnavailableException")
        void nodeError() {
            server.expect(method(HttpMethod.POST))
                    .andRespond(withSuccess(
                            "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32000,\"message\":\"header not found\"}}",
                            MediaType.APPLICATION_JSON));

            assertThatThrownBy(() -> client.call("eth_gasPrice", List.of()))
                    .isInstanceOf(DataUnavailableException.class)
                    .hasMessageContaining("header not found");
        }

        @Test
        @DisplayName("An HTTP failure becomes DataUnavailableException")
        void httpFailure() {
            server.expect(method(HttpMethod.POST)).andRespond(withServerError());

            assertThatThrownBy(() -> client.call("eth_gasPrice", List.of()))
                    .isInstanceOf(DataUnavailableException.class)
                    .hasMessageContaining("request failed");
        }
    }

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        @DisplayName("Parses hex quantities")
        void parseQuantity() {
            assertThat(JsonRpcClient.parseQuantity("0x6fc23ac00")).isEqualTo(BigInteger.valueOf(30_000_000_000L));
            assertThat(JsonRpcClient.parseQuantity("0x0")).isEqualTo(BigInteger.ZERO);
        }

        @Test
        @DisplayName("Rejects malformed quantities")
        void parseQuantity_malformed() {
            assertThatThrownBy(() -> JsonRpcClient.parseQuantity("1234")).isInstanceOf(DataUnavailableException.class);
            assertThatThrownBy(() -> JsonRpcClient.parseQuantity("0x")).isInstanceOf(DataUnavailableException.class);
            assertThatThrownBy(() -> JsonRpcClient.parseQuantity("0xzz")).isInstanceOf(DataUnavailableException.class);
        }

        @Test
        @DisplayName("Splits ABI data into 32-byte words")
        void abiWords() {
            String data = "0x" + "0".repeat(63) + "1" + "0".repeat(63) + "2";

            String[] words = JsonRpcClient.abiWords(data, 2);

            assertThat(words).hasSize(2);
            assertThat(new BigInteger(words[1], 16)).isEqualTo(BigInteger.TWO);
        }

        @Test
        @DisplayName("Rejects ABI data shorter than expected")
        void abiWords_tooShort() {
            assertThatThrownBy(() -> JsonRpcClient.abiWords("0x" + "0".repeat(64), 2))
                    .isInstanceOf(DataUnavailableException.class);
        }
    }
}
