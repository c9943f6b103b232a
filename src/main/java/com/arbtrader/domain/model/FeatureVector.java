package com.arbtrader.domain.model;

import lombok.Builder;
import lombok.Value;

/** Inputs handed to the confidence scorer for one candidate. */
@Value
@Builder
public class FeatureVector {

    double spreadBps;
    double depthUsd;
    double volatility;
    int sizeTier;
    double gasPriceGwei;
    double timeOfDay;
    int dayOfWeek;
}
