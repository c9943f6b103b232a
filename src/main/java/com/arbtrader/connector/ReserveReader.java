package com.arbtrader.connector;

import com.arbtrader.domain.model.ReservePair;
import java.util.Optional;

/**
 * Reads the current reserves of a venue's pool for a token pair.
 *
 * <p>Implementations live outside this engine (on-chain RPC readers, websocket caches).
 * The returned pair is oriented in the swap direction ({@code reserveIn} belongs to
 * {@code tokenIn}) and carries the venue's fee. An empty result means the reserves are
 * unavailable (no pool, stale cache, RPC error); it aborts only the route that asked.
 */
public interface ReserveReader {

    Optional<ReservePair> getReserves(String tokenIn, String tokenOut, String venue);
}
