package com.poc.excelingest.coerce;

import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.model.ValueType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts raw cell values to the Java type of a {@link ValueType}. Stateless and thread-safe.
 */
public class CellValueCoercer {

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "off");

    private static final Pattern NUMERIC_TEXT = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    // Tried in order, first match wins
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-M-d").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT));
    private static final DateTimeFormatter DATE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-M-d H:m:s").withResolverStyle(ResolverStyle.STRICT);

    public CoercionResult coerce(Object raw, ValueType type) {
        if (raw == null || (raw instanceof String && ((String) raw).isEmpty())) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("value", raw);
            context.put("expected_type", type.getTypeName());
            return new CoercionResult(raw, false, "Cell value is None/empty", context);
        }
        if (type.getJavaType().isInstance(raw)) {
            return new CoercionResult(raw, true, "Cell value is valid " + type.getTypeName(),
                    Map.of("value", raw, "actual_type", raw.getClass().getSimpleName()));
        }
        try {
            Object converted = convert(raw, type);
            return new CoercionResult(converted, true, "Cell value converted to " + type.getTypeName(), Map.of(
                    "original_value", raw,
                    "converted_value", converted,
                    "original_type", raw.getClass().getSimpleName(),
                    "expected_type", type.getTypeName()));
        } catch (IllegalArgumentException e) {
            return new CoercionResult(raw, false,
                    "Cannot convert value '" + raw + "' to " + type.getTypeName() + ": " + e.getMessage(), Map.of(
                    "value", raw,
                    "original_type", raw.getClass().getSimpleName(),
                    "expected_type", type.getTypeName(),
                    "error_code", ErrorCode.TYPE_CONVERSION_FAILED.name()));
        }
    }

    private Object convert(Object raw, ValueType type) {
        switch (type) {
            case STRING:
            case EMAIL:
            case URL:
                return raw.toString();
            case INTEGER:
                return toLong(raw);
            case FLOAT:
                return toDouble(raw);
            case BOOLEAN:
                return toBoolean(raw);
            case DATETIME:
            case DATE:
            case TIME:
                return toDateTime(raw);
            default:
                throw new IllegalArgumentException("conversion to " + type.getTypeName() + " is not supported");
        }
    }

    private static Long toLong(Object raw) {
        double number;
        if (raw instanceof String) {
            number = parseNumber((String) raw);
        } else if (raw instanceof Number) {
            if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
                return ((Number) raw).longValue();
            }
            if (raw instanceof BigDecimal) {
                return ((BigDecimal) raw).longValue();
            }
            number = ((Number) raw).doubleValue();
        } else if (raw instanceof Boolean) {
            return (Boolean) raw ? 1L : 0L;
        } else {
            throw new IllegalArgumentException("unsupported source type " + raw.getClass().getSimpleName());
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new IllegalArgumentException("not a finite number");
        }
        if (number >= Long.MAX_VALUE || number <= Long.MIN_VALUE) {
            throw new IllegalArgumentException("number out of integer range");
        }
        // Truncates toward zero, so "123.0" and 123.9 both give 123
        return (long) number;
    }

    private static Double toDouble(Object raw) {
        if (raw instanceof String) {
            return parseNumber((String) raw);
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (raw instanceof Boolean) {
            return (Boolean) raw ? 1.0 : 0.0;
        }
        throw new IllegalArgumentException("unsupported source type " + raw.getClass().getSimpleName());
    }

    private static double parseNumber(String text) {
        String trimmed = text.trim();
        if (!NUMERIC_TEXT.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("'" + text + "' is not a number");
        }
        return Double.parseDouble(trimmed);
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof String) {
            String word = ((String) raw).toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(word)) {
                return Boolean.TRUE;
            }
            if (FALSE_WORDS.contains(word)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("'" + raw + "' is not a boolean word");
        }
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue() != 0.0;
        }
        return Boolean.TRUE;
    }

    private static LocalDateTime toDateTime(Object raw) {
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay();
        }
        if (!(raw instanceof String)) {
            throw new IllegalArgumentException("cannot convert " + raw.getClass().getSimpleName() + " to datetime");
        }
        String text = (String) raw;
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate date = parseDate(text, format);
            if (date != null) {
                return date.atStartOfDay();
            }
        }
        try {
            return LocalDateTime.parse(text, DATE_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("cannot parse date string: " + text, e);
        }
    }

    private static LocalDate parseDate(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
