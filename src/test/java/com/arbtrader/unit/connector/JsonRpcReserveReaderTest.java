package com.arbtrader.unit.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.arbtrader.connector.JsonRpcClient;
import com.arbtrader.connector.JsonRpcReserveReader;
import com.arbtrader.domain.model.ReservePair;
import com.arbtrader.domain.model.VenueInfo;
import com.arbtrader.testutil.PoolBook;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Unit tests for JsonRpcReserveReader with a mocked JSON-RPC client. */
@ExtendWith(MockitoExtension.class)
class JsonRpcReserveReaderTest {

    private static final String FACTORY = "0x5757371414417b8c6caad45baef941abc7d3ab32";
    private static final String PAIR = "0x853ee4b2a13f8a742d64c8f088be7ba2131f670d";
    private static final String USDC = "0x2791bca1f2de4661ed88a30c99a7a9449aa84174";

    private static final String GET_RESERVES = "0x0902f1ac";
    private static final String TOKEN0 = "0x0dfe1681";
    private static final String GET_PAIR = "0xe6a43905";

    @Mock
    private JsonRpcClient jsonRpcClient;

    private JsonRpcReserveReader reader;

    @BeforeEach
    void setUp() {
        VenueInfo quickswap = VenueInfo.builder()
                .name(PoolBook.QUICKSWAP)
                .factoryAddress(FACTORY)
                .feeBps(30)
                .build();
        reader = new JsonRpcReserveReader(jsonRpcClient, PoolBook.tokenRegistry(), List.of(quickswap));
    }

    private static String word(BigInteger value) {
        return String.format("%064x", value);
    }

    private static String addressWord(String address) {
        return "0".repeat(24) + address.substring(2);
    }

    private void stubPool() {
        when(jsonRpcClient.ethCall(eq(FACTORY), startsWith(GET_PAIR))).thenReturn("0x" + addressWord(PAIR));
        when(jsonRpcClient.ethCall(PAIR, GET_RESERVES))
                .thenReturn("0x" + word(PoolBook.ONE_MILLION_USDC) + word(PoolBook.WETH_500) + word(BigInteger.ONE));
        when(jsonRpcClient.ethCall(PAIR, TOKEN0)).thenReturn("0x" + addressWord(USDC));
    }

    @Test
    @DisplayName("Orients reserves with token0 as the input side")
    void token0In() {
        stubPool();

        Optional<ReservePair> reserves = reader.getReserves("USDC", "WETH", PoolBook.QUICKSWAP);

        assertThat(reserves).contains(ReservePair.of(PoolBook.ONE_MILLION_USDC, PoolBook.WETH_500, 30));
    }

    @Test
    @DisplayName("Flips reserves when the input is token1")
    void token1In() {
        stubPool();

        Optional<ReservePair> reserves = reader.getReserves("WETH", "USDC", PoolBook.QUICKSWAP);

        assertThat(reserves).contains(ReservePair.of(PoolBook.WETH_500, PoolBook.ONE_MILLION_USDC, 30));
    }

    @Test
    @DisplayName("Looks the pair address up once per direction")
    void pairAddressCached() {
        stubPool();

        reader.getReserves("USDC", "WETH", PoolBook.QUICKSWAP);
        reader.getReserves("USDC", "WETH", PoolBook.QUICKSWAP);

        verify(jsonRpcClient, times(1)).ethCall(eq(FACTORY), anyString());
        verify(jsonRpcClient, times(2)).ethCall(PAIR, GET_RESERVES);
    }

    @Test
    @DisplayName("A zero pair address means no pool")
    void noPool() {
        when(jsonRpcClient.ethCall(eq(FACTORY), startsWith(GET_PAIR))).thenReturn("0x" + "0".repeat(64));

        assertThat(reader.getReserves("USDC", "WETH", PoolBook.QUICKSWAP)).isEmpty();
        verify(jsonRpcClient, never()).ethCall(anyString(), eq(GET_RESERVES));
    }

    @Test
    @DisplayName("An unknown venue has no reserves")
    void unknownVenue() {
        assertThat(reader.getReserves("USDC", "WETH", "uniswap")).isEmpty();
    }
}
