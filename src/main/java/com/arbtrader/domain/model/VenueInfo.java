package com.arbtrader.domain.model;

import lombok.Builder;
import lombok.Value;

/** A constant-product venue: its pair factory and the swap fee every pool charges. */
@Value
@Builder
public class VenueInfo {

    String name;
    String factoryAddress;
    int feeBps;
}
