package com.arbtrader.exception;

/**
 * A reserve, fee or score query could not be answered. Never escapes the orchestrator:
 * the affected route or size is skipped, or the gas path falls back to a fixed estimate.
 */
public class DataUnavailableException extends BaseException {

    public DataUnavailableException(String message) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DATA_UNAVAILABLE, message, cause);
    }
}
