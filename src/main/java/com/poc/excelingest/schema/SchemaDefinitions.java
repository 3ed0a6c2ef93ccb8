package com.poc.excelingest.schema;

import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.SchemaException;
import com.poc.excelingest.model.FieldDefinition;
import com.poc.excelingest.model.Schema;
import com.poc.excelingest.model.ValueType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts loosely typed schema definitions (parsed JSON) into {@link Schema} values.
 * <p>
 * Two shapes are understood:
 * <ul>
 *     <li>field list: {@code {"schema_name", "tab_name", "fields": [{"name", "cell_reference", "data_type", ...}]}}</li>
 *     <li>field map: {@code {field_name: {"value_address", "value_type", "is_drop_down", "label", "label_address"}}}</li>
 * </ul>
 */
public final class SchemaDefinitions {

    private SchemaDefinitions() {
    }

    public static Schema fromDefinition(Map<String, ?> definition) {
        if (definition == null) {
            throw new SchemaException("Schema definition is missing", ErrorCode.SCHEMA_INVALID);
        }
        String schemaName = text(definition.get("schema_name"));
        String tabName = text(definition.get("tab_name"));
        Object fields = definition.get("fields");
        if (!(fields instanceof List)) {
            throw new SchemaException("Schema '" + schemaName + "' must have a 'fields' list",
                    ErrorCode.SCHEMA_FIELD_MISSING, Map.of("schema_name", String.valueOf(schemaName)));
        }

        Schema.SchemaBuilder builder = Schema.builder().schemaName(schemaName).tabName(tabName);
        int index = 0;
        for (Object item : (List<?>) fields) {
            if (!(item instanceof Map)) {
                throw new SchemaException("Field " + index + " of schema '" + schemaName + "' is not an object",
                        ErrorCode.SCHEMA_INVALID, Map.of("field_index", index));
            }
            Map<?, ?> field = (Map<?, ?>) item;
            builder.field(FieldDefinition.builder()
                    .name(text(field.get("name")))
                    .valueAddress(text(field.get("cell_reference")))
                    .valueType(valueType(text(field.get("name")), field.get("data_type")))
                    .dropDown(Boolean.TRUE.equals(field.get("is_drop_down")))
                    .label(text(field.get("label")))
                    .labelAddress(text(field.get("label_address")))
                    .build());
            index++;
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        definition.forEach((key, value) -> {
            if (!"fields".equals(key)) {
                metadata.put(key, value);
            }
        });
        return builder.metadata(metadata).build();
    }

    /**
     * Builds a schema from the field-map shape used in schema files.
     */
    public static Schema fromFieldMap(String schemaName, String tabName, Map<String, ?> fieldMap,
                                      Map<String, ?> metadata) {
        if (fieldMap == null) {
            throw new SchemaException("Schema '" + schemaName + "' has no field map", ErrorCode.SCHEMA_FIELD_MISSING,
                    Map.of("schema_name", String.valueOf(schemaName)));
        }
        List<FieldDefinition> fields = new ArrayList<>();
        fieldMap.forEach((fieldName, lookup) -> {
            if (!(lookup instanceof Map)) {
                throw new SchemaException("Field '" + fieldName + "' of schema '" + schemaName + "' is not an object",
                        ErrorCode.SCHEMA_INVALID, Map.of("field_name", fieldName));
            }
            Map<?, ?> properties = (Map<?, ?>) lookup;
            fields.add(FieldDefinition.builder()
                    .name(fieldName)
                    .valueAddress(text(properties.get("value_address")))
                    .valueType(valueType(fieldName, properties.get("value_type")))
                    .dropDown(Boolean.TRUE.equals(properties.get("is_drop_down")))
                    .label(text(properties.get("label")))
                    .labelAddress(text(properties.get("label_address")))
                    .build());
        });
        return Schema.builder()
                .schemaName(schemaName)
                .tabName(tabName)
                .fields(fields)
                .metadata(metadata)
                .build();
    }

    /**
     * Accepts plain names ({@code "str"}) and type reprs ({@code "<class 'datetime.datetime'>"}).
     */
    static ValueType valueType(String fieldName, Object raw) {
        String name = text(raw);
        if (name != null && name.startsWith("<class '") && name.endsWith("'>")) {
            name = name.substring("<class '".length(), name.length() - 2);
        }
        String typeName = name;
        return ValueType.fromName(typeName).orElseThrow(() -> new SchemaException(
                "Field '" + fieldName + "' has unsupported data type: " + raw, ErrorCode.SCHEMA_INVALID,
                Map.of("field_name", String.valueOf(fieldName), "data_type", String.valueOf(raw))));
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
