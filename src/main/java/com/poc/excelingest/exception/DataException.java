package com.poc.excelingest.exception;

import java.util.Map;

/**
 * Extracted data is malformed relative to schema expectations.
 */
public class DataException extends ExcelProcessingException {

    public DataException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public DataException(String message, ErrorCode errorCode, Map<String, ?> context) {
        super(message, errorCode, context);
    }

    public DataException(String message, ErrorCode errorCode, Map<String, ?> context, Throwable cause) {
        super(message, errorCode, context, cause);
    }
}
