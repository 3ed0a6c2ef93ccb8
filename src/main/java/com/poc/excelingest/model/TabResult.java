package com.poc.excelingest.model;

import com.poc.excelingest.util.MapProjection;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data and diagnostics of a single processed tab.
 */
@Value
public class TabResult implements MapProjection.Projectable {

    String tabName;
    /** Schema used for extraction, null when the tab was read without one. */
    String schemaName;
    Map<String, Object> data;
    List<ValidationResult> validationResults;
    /** min_row, max_row, min_col, max_col of a schema-less read; empty otherwise. */
    Map<String, Integer> usedRange;

    public TabResult(String tabName, String schemaName, Map<String, ?> data, List<ValidationResult> validationResults) {
        this(tabName, schemaName, data, validationResults, Map.of());
    }

    public TabResult(String tabName, String schemaName, Map<String, ?> data, List<ValidationResult> validationResults,
                     Map<String, Integer> usedRange) {
        this.tabName = tabName;
        this.schemaName = schemaName;
        this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.validationResults = validationResults == null ? List.of() : List.copyOf(validationResults);
        this.usedRange = usedRange == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usedRange));
    }

    public boolean isValid() {
        return validationResults.stream().noneMatch(result -> !result.isValid() && result.isError());
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tab_name", tabName);
        map.put("schema", schemaName);
        map.put("data", MapProjection.expandMap(data));
        map.put("validation_results", MapProjection.expand(validationResults));
        if (!usedRange.isEmpty()) {
            map.put("range", new LinkedHashMap<>(usedRange));
        }
        return map;
    }
}
