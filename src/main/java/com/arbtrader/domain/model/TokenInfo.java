package com.arbtrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Static description of a configured token. {@code usdPrice} is the reference price used
 * to convert USD notionals into base units and base-unit profits back into USD.
 */
@Value
@Builder
public class TokenInfo {

    String symbol;
    String address;
    int decimals;
    BigDecimal usdPrice;
}
