package com.poc.excelingest.exception;

import java.util.Map;

/**
 * A schema definition is malformed or cannot be resolved.
 */
public class SchemaException extends ExcelProcessingException {

    public SchemaException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public SchemaException(String message, ErrorCode errorCode, Map<String, ?> context) {
        super(message, errorCode, context);
    }

    public SchemaException(String message, ErrorCode errorCode, Map<String, ?> context, Throwable cause) {
        super(message, errorCode, context, cause);
    }
}
