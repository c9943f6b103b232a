package com.arbtrader.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GasEstimate {

    BigInteger gasLimit;
    BigInteger gasPriceWei;
    BigDecimal costUsd;

    /** True when the fee oracle could not be queried and the fixed conservative estimate was used. */
    boolean fallback;
}
