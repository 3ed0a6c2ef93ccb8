package com.poc.excelingest.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message templates used by data checks. Templates use {@code {0}}, {@code {1}} placeholders.
 * Each caller passes its own instance, so overrides never leak between concurrent runs.
 */
public final class ValidationMessages {

    public static final String REQUIRED_MISSING = "required.missing";
    public static final String REQUIRED_PASSED = "required.passed";
    public static final String CONSTRAINT_FAILED = "constraint.failed";
    public static final String CONSTRAINT_PASSED = "constraint.passed";
    public static final String FORMAT_MISMATCH = "format.mismatch";
    public static final String FORMAT_MATCH = "format.match";
    public static final String RULE_FAILED = "rule.failed";
    public static final String RULE_PASSED = "rule.passed";
    public static final String RULE_ERROR = "rule.error";

    private static final Map<String, String> DEFAULTS = Map.of(
            REQUIRED_MISSING, "Required fields validation failed: {0}",
            REQUIRED_PASSED, "All {0} required fields are present and non-empty",
            CONSTRAINT_FAILED, "Field constraint validation failed: {0} violations",
            CONSTRAINT_PASSED, "All field constraints are satisfied",
            FORMAT_MISMATCH, "Value does not match {0} format",
            FORMAT_MATCH, "Value matches {0} format",
            RULE_FAILED, "Business rule {0} failed",
            RULE_PASSED, "Business rule {0} passed",
            RULE_ERROR, "Business rule {0} execution error: {1}");

    private static final ValidationMessages DEFAULT_INSTANCE = new ValidationMessages(Map.of());

    private final Map<String, String> overrides;

    private ValidationMessages(Map<String, String> overrides) {
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public static ValidationMessages defaults() {
        return DEFAULT_INSTANCE;
    }

    public static ValidationMessages withOverrides(Map<String, String> overrides) {
        return overrides == null || overrides.isEmpty() ? DEFAULT_INSTANCE : new ValidationMessages(overrides);
    }

    public String template(String key) {
        return overrides.getOrDefault(key, DEFAULTS.getOrDefault(key, key));
    }

    public String format(String key, Object... args) {
        String text = template(key);
        for (int i = 0; i < args.length; i++) {
            text = text.replace("{" + i + "}", String.valueOf(args[i]));
        }
        return text;
    }
}
