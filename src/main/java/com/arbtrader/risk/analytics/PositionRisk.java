package com.arbtrader.risk.analytics;

import lombok.Value;

/** An open exposure for portfolio heat: {@code size} in USD, {@code risk} as the fraction of size at risk. */
@Value
public class PositionRisk {

    double size;
    double risk;
}
