package com.poc.excelingest.exception;

import java.util.Map;

/**
 * Invalid configuration supplied by the caller.
 */
public class ConfigurationException extends ExcelProcessingException {

    public ConfigurationException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public ConfigurationException(String message, ErrorCode errorCode, Map<String, ?> context) {
        super(message, errorCode, context);
    }

    public ConfigurationException(String message, ErrorCode errorCode, Map<String, ?> context, Throwable cause) {
        super(message, errorCode, context, cause);
    }
}
