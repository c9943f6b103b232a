package com.arbtrader.domain.enums;

public enum TradeStatus {
    PENDING,
    SUCCESS,
    FAILED
}
