package com.arbtrader.connector;

import com.arbtrader.exception.DataUnavailableException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Data;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Minimal JSON-RPC 2.0 client for the chain node. Transport errors, node errors and
 * empty results all surface as {@link DataUnavailableException}.
 */
@Component
public class JsonRpcClient {

    private final RestClient rpcRestClient;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcClient(RestClient rpcRestClient) {
        this.rpcRestClient = rpcRestClient;
    }

    /** Calls {@code method} and returns the raw {@code result} string. */
    public String call(String method, List<Object> params) {
        JsonRpcResponse response;
        try {
            response = rpcRestClient
                    .post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("jsonrpc", "2.0", "id", requestIds.incrementAndGet(), "method", method, "params", params))
                    .retrieve()
                    .body(JsonRpcResponse.class);
        } catch (RestClientException e) {
            throw new DataUnavailableException(method + " request failed: " + e.getMessage(), e);
        }

        if (response == null || response.getError() != null || response.getResult() == null) {
            throw new DataUnavailableException(method + " returned an error: "
                    + (response != null ? response.getError() : "empty body"));
        }
        return response.getResult();
    }

    /** {@code eth_call} against {@code to} at the latest block. */
    public String ethCall(String to, String data) {
        return call("eth_call", List.of(Map.of("to", to, "data", data), "latest"));
    }

    /** Parses a JSON-RPC hex quantity ("0x4a817c800"). */
    public static BigInteger parseQuantity(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            throw new DataUnavailableException("Malformed JSON-RPC quantity: " + hex);
        }
        try {
            return new BigInteger(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            throw new DataUnavailableException("Malformed JSON-RPC quantity: " + hex, e);
        }
    }

    /**
     * Splits ABI-encoded return data into 32-byte words.
     *
     * @throws DataUnavailableException if fewer than {@code expectedWords} words are present
     */
    public static String[] abiWords(String data, int expectedWords) {
        String hex = data != null && data.startsWith("0x") ? data.substring(2) : data;
        if (hex == null || hex.length() < expectedWords * 64) {
            throw new DataUnavailableException("ABI result too short, expected " + expectedWords + " words: " + data);
        }
        String[] words = new String[hex.length() / 64];
        for (int i = 0; i < words.length; i++) {
            words[i] = hex.substring(i * 64, (i + 1) * 64);
        }
        return words;
    }

    @Data
    public static class JsonRpcResponse {
        private String jsonrpc;
        private Long id;
        private String result;
        private Map<String, Object> error;
    }
}
