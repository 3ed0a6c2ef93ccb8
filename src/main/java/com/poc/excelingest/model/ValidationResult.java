package com.poc.excelingest.model;

import com.poc.excelingest.util.MapProjection;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one check. Created once, never mutated, collected into ordered lists.
 */
@Value
public class ValidationResult implements MapProjection.Projectable {

    String fieldName;
    boolean valid;
    String message;
    Severity severity;
    String location;
    Map<String, Object> context;
    LocalDateTime timestamp;

    public ValidationResult(String fieldName, boolean valid, String message, Severity severity,
                            String location, Map<String, ?> context) {
        if (severity == null) {
            throw new IllegalArgumentException("Severity must be one of ERROR, WARNING, INFO but was null");
        }
        this.fieldName = fieldName;
        this.valid = valid;
        this.message = message;
        this.severity = severity;
        this.location = location;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        this.timestamp = LocalDateTime.now();
    }

    public ValidationResult(String fieldName, boolean valid, String message, String severity,
                            String location, Map<String, ?> context) {
        this(fieldName, valid, message, Severity.parse(severity), location, context);
    }

    public static ValidationResult error(String fieldName, String message, String location) {
        return new ValidationResult(fieldName, false, message, Severity.ERROR, location, Map.of());
    }

    public static ValidationResult error(String fieldName, String message, String location, Map<String, ?> context) {
        return new ValidationResult(fieldName, false, message, Severity.ERROR, location, context);
    }

    public static ValidationResult warning(String fieldName, String message, String location, Map<String, ?> context) {
        return new ValidationResult(fieldName, false, message, Severity.WARNING, location, context);
    }

    public static ValidationResult passed(String fieldName, String message, String location) {
        return new ValidationResult(fieldName, true, message, Severity.INFO, location, Map.of());
    }

    public static ValidationResult passed(String fieldName, String message, String location, Map<String, ?> context) {
        return new ValidationResult(fieldName, true, message, Severity.INFO, location, context);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    public boolean isInfo() {
        return severity == Severity.INFO;
    }

    public String getSummary() {
        return (valid ? "PASS" : "FAIL") + " [" + severity + "] " + fieldName + " @ " + location + ": " + message;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field_name", fieldName);
        map.put("is_valid", valid);
        map.put("message", message);
        map.put("severity", severity.name());
        map.put("location", location);
        map.put("context", MapProjection.expandMap(context));
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
