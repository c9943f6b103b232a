package com.arbtrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    DATA_UNAVAILABLE("DATA_UNAVAILABLE"),
    INSUFFICIENT_LIQUIDITY("INSUFFICIENT_LIQUIDITY"),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION"),
    PERSISTENCE_FAILURE("PERSISTENCE_FAILURE");

    private final String code;
}
