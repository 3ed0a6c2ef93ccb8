package com.poc.excelingest.model;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Declared type of a schema field, with the spellings accepted in schema files.
 */
public enum ValueType {
    STRING(String.class, "string", "str", "text"),
    INTEGER(Long.class, "integer", "int", "number"),
    FLOAT(Double.class, "float", "decimal", "double"),
    BOOLEAN(Boolean.class, "boolean", "bool", "logical"),
    DATETIME(LocalDateTime.class, "datetime", "datetime.datetime"),
    DATE(LocalDateTime.class, "date"),
    TIME(LocalDateTime.class, "time"),
    EMAIL(String.class, "email"),
    URL(String.class, "url", "hyperlink");

    private final Class<?> javaType;
    private final List<String> names;

    ValueType(Class<?> javaType, String... names) {
        this.javaType = javaType;
        this.names = List.of(names);
    }

    /**
     * Java type a coerced value of this kind has.
     */
    public Class<?> getJavaType() {
        return javaType;
    }

    public String getTypeName() {
        return names.get(0);
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isTemporal() {
        return javaType == LocalDateTime.class;
    }

    public static Optional<ValueType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.names.contains(normalized))
                .findFirst();
    }

    public static boolean isSupported(String name) {
        return fromName(name).isPresent();
    }
}
