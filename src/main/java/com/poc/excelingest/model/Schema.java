package com.poc.excelingest.model;

import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.SchemaException;
import com.poc.excelingest.util.MapProjection;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Named set of field definitions targeting one worksheet.
 */
@Value
public class Schema implements MapProjection.Projectable {

    String schemaName;
    String tabName;
    List<FieldDefinition> fields;
    Map<String, Object> metadata;

    @Builder
    public Schema(String schemaName, String tabName, @Singular List<FieldDefinition> fields, Map<String, ?> metadata) {
        if (schemaName == null || schemaName.isBlank()) {
            throw new SchemaException("Schema must have a non-empty schema_name", ErrorCode.SCHEMA_INVALID);
        }
        if (tabName == null || tabName.isBlank()) {
            throw new SchemaException("Schema '" + schemaName + "' must have a non-empty tab_name",
                    ErrorCode.SCHEMA_INVALID, Map.of("schema_name", schemaName));
        }
        if (fields == null || fields.isEmpty()) {
            throw new SchemaException("Schema '" + schemaName + "' must contain at least one field",
                    ErrorCode.SCHEMA_FIELD_MISSING, Map.of("schema_name", schemaName));
        }
        Set<String> seen = new HashSet<>();
        for (FieldDefinition field : fields) {
            if (!seen.add(field.getName())) {
                throw new SchemaException("Schema '" + schemaName + "' declares field '" + field.getName() + "' twice",
                        ErrorCode.SCHEMA_INVALID, Map.of("schema_name", schemaName, "field_name", field.getName()));
            }
        }
        this.schemaName = schemaName;
        this.tabName = tabName;
        this.fields = List.copyOf(fields);
        this.metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Optional<FieldDefinition> getField(String name) {
        return fields.stream().filter(field -> field.getName().equals(name)).findFirst();
    }

    public List<String> getFieldNames() {
        return fields.stream().map(FieldDefinition::getName).collect(Collectors.toList());
    }

    /**
     * Field name to default value, in declaration order.
     */
    public Map<String, Object> defaultValues() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        fields.forEach(field -> defaults.put(field.getName(), field.defaultValue()));
        return defaults;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("schema_name", schemaName);
        map.put("tab_name", tabName);
        map.put("fields", MapProjection.expand(fields));
        map.put("metadata", MapProjection.expandMap(metadata));
        return map;
    }
}
