package com.poc.excelingest.validation;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Well-known text formats checked by {@link DataValidator#validateDataFormat}.
 */
public enum DataFormat {
    EMAIL("email", "^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$"),
    PHONE("phone", "^[+]?[1-9]\\d{0,15}$"),
    URL("url", "^https?://(www\\.)?[-a-zA-Z0-9@:%._+~#=]{1,256}\\.[a-zA-Z0-9()]{1,6}\\b([-a-zA-Z0-9()@:%_+.~#?&/=]*)$"),
    ZIP_CODE("zip_code", "^\\d{5}(-\\d{4})?$"),
    SSN("ssn", "^\\d{3}-\\d{2}-\\d{4}$"),
    CREDIT_CARD("credit_card", "^\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}$");

    private final String key;
    private final Pattern pattern;

    DataFormat(String key, String regex) {
        this.key = key;
        this.pattern = Pattern.compile(regex);
    }

    public String getKey() {
        return key;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public boolean matches(String value) {
        return value != null && pattern.matcher(value).matches();
    }

    public static Optional<DataFormat> fromKey(String key) {
        return Arrays.stream(values()).filter(format -> format.key.equalsIgnoreCase(key)).findFirst();
    }
}
