package com.arbtrader.domain.model;

import lombok.Value;

/** One hop of a route: sell {@code tokenIn} for {@code tokenOut} on {@code venue}. */
@Value
public class RouteLeg {

    String tokenIn;
    String tokenOut;
    String venue;

    @Override
    public String toString() {
        return tokenIn + "->" + tokenOut + "@" + venue;
    }
}
