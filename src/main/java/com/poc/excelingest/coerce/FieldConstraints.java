package com.poc.excelingest.coerce;

import com.poc.excelingest.exception.ConfigurationException;
import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.util.MapProjection;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Constraints checked on an already coerced value. Every violated constraint is reported,
 * checking does not stop at the first one.
 */
@Value
@Builder
public class FieldConstraints implements MapProjection.Projectable {

    Object minValue;
    Object maxValue;
    Integer minLength;
    Integer maxLength;
    Pattern pattern;
    Collection<?> allowedValues;
    Predicate<Object> customValidator;

    @Value
    public static class Violation implements MapProjection.Projectable {
        String constraint;
        Object value;
        Object limit;
        String message;

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("constraint", constraint);
            map.put("value", value);
            map.put("limit", limit);
            map.put("message", message);
            return map;
        }
    }

    public static FieldConstraints none() {
        return builder().build();
    }

    /**
     * Reads the keys {@code min_value}, {@code max_value}, {@code min_length}, {@code max_length},
     * {@code pattern}, {@code enum} and {@code custom_validator}.
     */
    @SuppressWarnings("unchecked")
    public static FieldConstraints fromMap(Map<String, ?> constraints) {
        FieldConstraintsBuilder builder = builder();
        if (constraints == null) {
            return builder.build();
        }
        builder.minValue(constraints.get("min_value"));
        builder.maxValue(constraints.get("max_value"));
        builder.minLength(length(constraints, "min_length"));
        builder.maxLength(length(constraints, "max_length"));
        Object pattern = constraints.get("pattern");
        if (pattern instanceof Pattern) {
            builder.pattern((Pattern) pattern);
        } else if (pattern != null) {
            try {
                builder.pattern(Pattern.compile(pattern.toString()));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException("Invalid pattern constraint: " + pattern, ErrorCode.CONFIG_VALUE_INVALID,
                        Map.of("pattern", pattern.toString()), e);
            }
        }
        Object allowed = constraints.get("enum");
        if (allowed instanceof Collection) {
            builder.allowedValues((Collection<?>) allowed);
        }
        Object custom = constraints.get("custom_validator");
        if (custom instanceof Predicate) {
            builder.customValidator((Predicate<Object>) custom);
        }
        return builder.build();
    }

    private static Integer length(Map<String, ?> constraints, String key) {
        Object value = constraints.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number)) {
            throw new ConfigurationException(key + " must be a number, got " + value, ErrorCode.CONFIG_VALUE_INVALID,
                    Map.of("constraint", key));
        }
        return ((Number) value).intValue();
    }

    public boolean isEmpty() {
        return minValue == null && maxValue == null && minLength == null && maxLength == null
                && pattern == null && allowedValues == null && customValidator == null;
    }

    public List<Violation> violations(Object value) {
        List<Violation> violations = new ArrayList<>();

        if (minValue != null && value != null) {
            Integer order = compare(value, minValue);
            if (order != null && order < 0) {
                violations.add(new Violation("min_value", value, minValue,
                        "Value " + value + " is less than minimum " + minValue));
            }
        }
        if (maxValue != null && value != null) {
            Integer order = compare(value, maxValue);
            if (order != null && order > 0) {
                violations.add(new Violation("max_value", value, maxValue,
                        "Value " + value + " is greater than maximum " + maxValue));
            }
        }
        if (value instanceof String) {
            int length = ((String) value).length();
            if (minLength != null && length < minLength) {
                violations.add(new Violation("min_length", length, minLength,
                        "String length " + length + " is less than minimum " + minLength));
            }
            if (maxLength != null && length > maxLength) {
                violations.add(new Violation("max_length", length, maxLength,
                        "String length " + length + " is greater than maximum " + maxLength));
            }
            // Anchored at the start only
            if (pattern != null && !pattern.matcher((String) value).lookingAt()) {
                violations.add(new Violation("pattern", value, pattern.pattern(),
                        "Value '" + value + "' does not match pattern '" + pattern.pattern() + "'"));
            }
        }
        if (allowedValues != null && allowedValues.stream().noneMatch(allowed -> sameValue(allowed, value))) {
            violations.add(new Violation("enum", value, new ArrayList<>(allowedValues),
                    "Value '" + value + "' is not in allowed values: " + allowedValues));
        }
        if (customValidator != null) {
            try {
                if (!customValidator.test(value)) {
                    violations.add(new Violation("custom_validator", value, null,
                            "Custom validation function returned false"));
                }
            } catch (RuntimeException e) {
                violations.add(new Violation("custom_validator", value, null,
                        "Custom validation function error: " + e.getMessage()));
            }
        }
        return violations;
    }

    /**
     * Numbers compare by value across types; other values only against the same class. Null when not comparable.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Integer compare(Object value, Object limit) {
        if (value instanceof Number && limit instanceof Number) {
            return Double.compare(((Number) value).doubleValue(), ((Number) limit).doubleValue());
        }
        if (value instanceof Comparable && limit.getClass().isInstance(value)) {
            return ((Comparable) value).compareTo(limit);
        }
        return null;
    }

    private static boolean sameValue(Object allowed, Object value) {
        if (allowed instanceof Number && value instanceof Number) {
            return ((Number) allowed).doubleValue() == ((Number) value).doubleValue();
        }
        return allowed == null ? value == null : allowed.equals(value);
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (minValue != null) {
            map.put("min_value", minValue);
        }
        if (maxValue != null) {
            map.put("max_value", maxValue);
        }
        if (minLength != null) {
            map.put("min_length", minLength);
        }
        if (maxLength != null) {
            map.put("max_length", maxLength);
        }
        if (pattern != null) {
            map.put("pattern", pattern.pattern());
        }
        if (allowedValues != null) {
            map.put("enum", new ArrayList<>(allowedValues));
        }
        if (customValidator != null) {
            map.put("custom_validator", "<predicate>");
        }
        return map;
    }
}
