package com.poc.excelingest.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every failure raised by the ingest core.
 */
@Getter
public class ExcelProcessingException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> context;

    public ExcelProcessingException(String message, ErrorCode errorCode) {
        this(message, errorCode, Map.of(), null);
    }

    public ExcelProcessingException(String message, ErrorCode errorCode, Map<String, ?> context) {
        this(message, errorCode, context, null);
    }

    public ExcelProcessingException(String message, ErrorCode errorCode, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode == null ? ErrorCode.UNKNOWN_ERROR : errorCode;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * Error category as used in serialized form, e.g. "SchemaException".
     */
    public String getErrorType() {
        return getClass().getSimpleName();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error_type", getErrorType());
        map.put("error_code", errorCode.name());
        map.put("message", getMessage());
        map.put("context", new LinkedHashMap<>(context));
        if (getCause() != null) {
            map.put("original_exception", getCause().toString());
        }
        return map;
    }

    public String getErrorSummary() {
        return "[" + errorCode.name() + "] " + getMessage();
    }
}
