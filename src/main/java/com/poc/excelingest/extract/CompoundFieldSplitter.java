package com.poc.excelingest.extract;

import com.poc.excelingest.exception.DataException;
import com.poc.excelingest.exception.ErrorCode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces combined fields with their parts, e.g. {@code lat_and_long = "37.7,-122.4"} becomes
 * {@code lat_arb = "37.7"} and {@code long_arb = "-122.4"}. The combined key is always removed.
 */
public class CompoundFieldSplitter {

    public static final String LAT_AND_LONG = "lat_and_long";
    public static final String LATITUDE = "lat_arb";
    public static final String LONGITUDE = "long_arb";

    private final Map<String, List<String>> compoundFields;

    public CompoundFieldSplitter() {
        this(Map.of(LAT_AND_LONG, List.of(LATITUDE, LONGITUDE)));
    }

    public CompoundFieldSplitter(Map<String, List<String>> compoundFields) {
        this.compoundFields = new LinkedHashMap<>(compoundFields);
    }

    /**
     * Splits in place. Null or empty values just drop the combined key.
     *
     * @throws DataException when a non-empty value does not have exactly one part per target field
     */
    public void split(Map<String, Object> data) {
        compoundFields.forEach((field, targets) -> {
            if (!data.containsKey(field)) {
                return;
            }
            Object value = data.remove(field);
            if (value == null || value.toString().isEmpty()) {
                return;
            }
            String[] parts = value.toString().split(",", -1);
            if (parts.length != targets.size()) {
                throw new DataException("Field '" + field + "' must be blank or " + targets.size()
                        + " comma separated values, got '" + value + "'", ErrorCode.DATA_MALFORMED,
                        Map.of("field_name", field, "value", value.toString(), "expected_parts", targets.size()));
            }
            for (int i = 0; i < parts.length; i++) {
                data.put(targets.get(i), parts[i]);
            }
        });
    }
}
