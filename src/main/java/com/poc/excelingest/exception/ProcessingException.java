package com.poc.excelingest.exception;

import java.util.Map;

/**
 * An extraction or conversion step failed.
 */
public class ProcessingException extends ExcelProcessingException {

    public ProcessingException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public ProcessingException(String message, ErrorCode errorCode, Map<String, ?> context) {
        super(message, errorCode, context);
    }

    public ProcessingException(String message, ErrorCode errorCode, Map<String, ?> context, Throwable cause) {
        super(message, errorCode, context, cause);
    }
}
