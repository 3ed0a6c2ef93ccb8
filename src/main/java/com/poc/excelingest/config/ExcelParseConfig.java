package com.poc.excelingest.config;

import com.poc.excelingest.exception.ConfigurationException;
import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.util.MapProjection;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Limits and switches for one processing run. Invalid values are rejected when the config is built.
 */
@Value
public class ExcelParseConfig implements MapProjection.Projectable {

    public static final List<String> DEFAULT_EXTENSIONS = List.of(".xlsx", ".xls");

    boolean validateFileExists;
    boolean validateFileFormat;
    int maxFileSizeMb;
    List<String> allowedExtensions;
    boolean strictMode;
    boolean skipInvalidTabs;
    int maxTabs;
    int maxRows;
    int maxColumns;
    boolean trimStrings;
    int maxFieldCount;
    MissingValuePolicy missingValuePolicy;

    @Builder(toBuilder = true)
    public ExcelParseConfig(Boolean validateFileExists, Boolean validateFileFormat, Integer maxFileSizeMb,
                            List<String> allowedExtensions, Boolean strictMode, Boolean skipInvalidTabs,
                            Integer maxTabs, Integer maxRows, Integer maxColumns, Boolean trimStrings,
                            Integer maxFieldCount, MissingValuePolicy missingValuePolicy) {
        this.validateFileExists = validateFileExists == null || validateFileExists;
        this.validateFileFormat = validateFileFormat == null || validateFileFormat;
        this.maxFileSizeMb = positive("max_file_size_mb", maxFileSizeMb, 100);
        this.allowedExtensions = extensions(allowedExtensions);
        this.strictMode = strictMode != null && strictMode;
        this.skipInvalidTabs = skipInvalidTabs == null || skipInvalidTabs;
        this.maxTabs = positive("max_tabs", maxTabs, 50);
        this.maxRows = positive("max_rows", maxRows, 1000);
        this.maxColumns = positive("max_columns", maxColumns, 26);
        this.trimStrings = trimStrings == null || trimStrings;
        this.maxFieldCount = positive("max_field_count", maxFieldCount, 1000);
        this.missingValuePolicy = missingValuePolicy == null ? MissingValuePolicy.SKIP : missingValuePolicy;
    }

    public static ExcelParseConfig defaults() {
        return builder().build();
    }

    private static int positive(String key, Integer value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive, got " + value, ErrorCode.CONFIG_VALUE_INVALID,
                    Map.of("config_key", key, "config_value", value));
        }
        return value;
    }

    private static List<String> extensions(List<String> values) {
        if (values == null) {
            return DEFAULT_EXTENSIONS;
        }
        if (values.isEmpty()) {
            throw new ConfigurationException("allowed_extensions must not be empty", ErrorCode.CONFIG_VALUE_INVALID,
                    Map.of("config_key", "allowed_extensions"));
        }
        List<String> normalized = new ArrayList<>();
        for (String value : values) {
            if (value == null || !value.startsWith(".") || value.length() < 2) {
                throw new ConfigurationException("allowed_extensions entries must start with '.', got " + value,
                        ErrorCode.CONFIG_VALUE_INVALID, Map.of("config_key", "allowed_extensions",
                        "config_value", String.valueOf(value)));
            }
            normalized.add(value.toLowerCase(Locale.ROOT));
        }
        return List.copyOf(normalized);
    }

    public boolean isExtensionAllowed(String extension) {
        return extension != null && allowedExtensions.contains(extension.toLowerCase(Locale.ROOT));
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeMb * 1024L * 1024L;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("validate_file_exists", validateFileExists);
        map.put("validate_file_format", validateFileFormat);
        map.put("max_file_size_mb", maxFileSizeMb);
        map.put("allowed_extensions", new ArrayList<>(allowedExtensions));
        map.put("strict_mode", strictMode);
        map.put("skip_invalid_tabs", skipInvalidTabs);
        map.put("max_tabs", maxTabs);
        map.put("max_rows", maxRows);
        map.put("max_columns", maxColumns);
        map.put("trim_strings", trimStrings);
        map.put("max_field_count", maxFieldCount);
        map.put("missing_value_policy", missingValuePolicy.name());
        return map;
    }
}
