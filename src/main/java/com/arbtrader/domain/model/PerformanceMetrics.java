package com.arbtrader.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PerformanceMetrics {

    int sampleSize;
    double sharpeRatio;
    double sortinoRatio;
    double valueAtRisk;
    double maxDrawdown;
    double winRate;
}
