package com.poc.excelingest.model;

import java.util.Locale;

public enum Severity {
    ERROR,
    WARNING,
    INFO;

    /**
     * Case-insensitive lookup; anything other than error, warning or info is rejected.
     */
    public static Severity parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Severity must be one of ERROR, WARNING, INFO but was null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Severity must be one of ERROR, WARNING, INFO but was '" + value + "'", e);
        }
    }
}
