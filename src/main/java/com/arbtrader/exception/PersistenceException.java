package com.arbtrader.exception;

/**
 * Writing a trade or risk-event record failed. Callers log it; in-memory risk state
 * is never rolled back because of it.
 */
public class PersistenceException extends BaseException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, message, cause);
    }
}
