package com.arbtrader.exception;

import java.util.Map;

public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.INVALID_CONFIGURATION, message);
    }

    public InvalidConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_CONFIGURATION, message, details);
    }
}
