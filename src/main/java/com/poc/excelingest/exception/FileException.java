package com.poc.excelingest.exception;

import java.util.Map;

/**
 * File existence, permission, size or format failure.
 */
public class FileException extends ExcelProcessingException {

    public FileException(String message, ErrorCode errorCode) {
        super(message, errorCode);
    }

    public FileException(String message, ErrorCode errorCode, Map<String, ?> context) {
        super(message, errorCode, context);
    }

    public FileException(String message, ErrorCode errorCode, Map<String, ?> context, Throwable cause) {
        super(message, errorCode, context, cause);
    }
}
