package com.poc.excelingest.coerce;

import com.poc.excelingest.model.Severity;
import com.poc.excelingest.model.ValidationResult;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of coercing one raw value. On failure {@code value} is the untouched raw value.
 */
@Value
public class CoercionResult {

    Object value;
    boolean valid;
    String message;
    Map<String, Object> context;

    CoercionResult(Object value, boolean valid, String message, Map<String, ?> context) {
        this.value = value;
        this.valid = valid;
        this.message = message;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public ValidationResult toValidationResult(String fieldName, String location) {
        return new ValidationResult(fieldName, valid, message, valid ? Severity.INFO : Severity.ERROR, location, context);
    }
}
