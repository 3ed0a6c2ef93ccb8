package com.poc.excelingest.model;

import com.poc.excelingest.util.MapProjection;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured content of one workbook: metadata tab pairs, tab-to-schema map and per-tab field values.
 */
@Value
public class ParsedWorkbook implements MapProjection.Projectable {

    Map<String, Object> metadata;
    Map<String, String> schemas;
    Map<String, Map<String, Object>> tabContents;

    public ParsedWorkbook(Map<String, ?> metadata, Map<String, String> schemas,
                          Map<String, ? extends Map<String, ?>> tabContents) {
        this.metadata = copy(metadata);
        this.schemas = schemas == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
        Map<String, Map<String, Object>> tabs = new LinkedHashMap<>();
        if (tabContents != null) {
            tabContents.forEach((tab, content) -> tabs.put(tab, copy(content)));
        }
        this.tabContents = Collections.unmodifiableMap(tabs);
    }

    public static ParsedWorkbook empty() {
        return new ParsedWorkbook(Map.of(), Map.of(), Map.of());
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("metadata", MapProjection.expandMap(metadata));
        map.put("schemas", MapProjection.expandMap(schemas));
        map.put("tab_contents", MapProjection.expandMap(tabContents));
        return map;
    }
}
