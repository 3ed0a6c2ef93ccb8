package com.poc.excelingest.validation;

import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.model.ValueType;
import com.poc.excelingest.util.CellAddress;
import com.poc.excelingest.workbook.WorkbookHandle;
import com.poc.excelingest.workbook.WorksheetHandle;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Checks raw schema definitions in the field-list shape
 * ({@code schema_name}, {@code tab_name}, {@code fields[]} of {@code name}, {@code cell_reference}, {@code data_type}).
 */
public class SchemaValidator {

    public static final List<String> REQUIRED_SCHEMA_KEYS = List.of("fields", "tab_name", "schema_name");
    public static final List<String> REQUIRED_FIELD_PROPERTIES = List.of("name", "cell_reference", "data_type");

    // Checked in order, the first matching group wins
    private static final Map<String, List<String>> FIELD_CATEGORIES = new LinkedHashMap<>();

    static {
        FIELD_CATEGORIES.put("text", List.of("name", "title", "description"));
        FIELD_CATEGORIES.put("datetime", List.of("date", "time", "created", "updated"));
        FIELD_CATEGORIES.put("numeric", List.of("count", "number", "quantity", "amount"));
        FIELD_CATEGORIES.put("contact", List.of("email", "url", "link"));
        FIELD_CATEGORIES.put("boolean", List.of("active", "enabled", "status"));
    }

    /**
     * Definition check first; when it passes, field, data type and consistency checks, and cell references
     * too when a workbook is given.
     */
    public List<ValidationResult> validateSchema(Map<String, ?> schema, WorkbookHandle workbook) {
        List<ValidationResult> results = new ArrayList<>();
        ValidationResult definition = validateSchemaDefinition(schema);
        results.add(definition);
        if (!definition.isValid()) {
            return results;
        }
        results.add(validateFieldDefinitions(schema));
        results.add(validateDataTypes(schema));
        results.add(validateDataTypeConsistency(schema));
        if (workbook != null) {
            results.add(validateCellReferences(schema, workbook));
        }
        return results;
    }

    public ValidationResult validateSchemaDefinition(Map<String, ?> schema) {
        if (schema == null) {
            return ValidationResult.error("schema_structure", "Schema must be a dictionary", "schema");
        }
        List<String> missing = new ArrayList<>();
        REQUIRED_SCHEMA_KEYS.stream().filter(key -> !schema.containsKey(key)).forEach(missing::add);
        if (!missing.isEmpty()) {
            return ValidationResult.error("schema_structure", "Schema missing required fields: " + missing, "schema",
                    Map.of("missing_fields", missing));
        }
        Object schemaName = schema.get("schema_name");
        if (!isNonEmptyString(schemaName)) {
            return ValidationResult.error("schema_name", "Schema must have a valid string name", "schema");
        }
        if (!isNonEmptyString(schema.get("tab_name"))) {
            return ValidationResult.error("tab_name", "Schema must have a valid string tab name", "schema");
        }
        Object fields = schema.get("fields");
        if (!(fields instanceof List)) {
            return ValidationResult.error("fields", "Schema fields must be a list", "schema");
        }
        if (((List<?>) fields).isEmpty()) {
            return ValidationResult.error("fields", "Schema must contain at least one field", "schema");
        }
        List<ValidationResult> failed = failedFieldDefinitions((List<?>) fields);
        if (!failed.isEmpty()) {
            return ValidationResult.error("schema_fields",
                    "Schema contains " + failed.size() + " invalid field definitions", "schema",
                    Map.of("failed_fields", failed));
        }
        return ValidationResult.passed("schema_structure", "Schema '" + schemaName + "' is valid with "
                + ((List<?>) fields).size() + " fields", "schema", Map.of(
                "schema_name", schemaName,
                "tab_name", schema.get("tab_name"),
                "field_count", ((List<?>) fields).size()));
    }

    public ValidationResult validateFieldDefinitions(Map<String, ?> schema) {
        List<?> fields = fields(schema);
        List<ValidationResult> failed = failedFieldDefinitions(fields);
        if (!failed.isEmpty()) {
            return ValidationResult.error("field_definitions",
                    "Schema contains " + failed.size() + " invalid field definitions", "schema",
                    Map.of("failed_fields", failed));
        }
        return ValidationResult.passed("field_definitions", "All " + fields.size() + " field definitions are valid",
                "schema", Map.of("field_count", fields.size()));
    }

    private List<ValidationResult> failedFieldDefinitions(List<?> fields) {
        List<ValidationResult> failed = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            ValidationResult result = validateFieldDefinition(fields.get(i), i);
            if (!result.isValid()) {
                failed.add(result);
            }
        }
        return failed;
    }

    public ValidationResult validateFieldDefinition(Object definition, int index) {
        String fieldId = "field_" + index;
        String location = "schema.fields[" + index + "]";
        if (!(definition instanceof Map)) {
            return ValidationResult.error(fieldId, "Field at index " + index + " must be a dictionary", location);
        }
        Map<?, ?> field = (Map<?, ?>) definition;
        List<String> missing = new ArrayList<>();
        REQUIRED_FIELD_PROPERTIES.stream().filter(key -> !field.containsKey(key)).forEach(missing::add);
        if (!missing.isEmpty()) {
            return ValidationResult.error(fieldId, "Field missing required properties: " + missing, location,
                    Map.of("missing_properties", missing));
        }
        Object name = field.get("name");
        if (!isNonEmptyString(name)) {
            return ValidationResult.error(fieldId, "Field name must be a non-empty string", location);
        }
        Object cellReference = field.get("cell_reference");
        if (!isNonEmptyString(cellReference)) {
            return ValidationResult.error(fieldId, "Field must have a valid cell reference", location);
        }
        if (!CellAddress.isValid((String) cellReference)) {
            return ValidationResult.error(fieldId, "Invalid cell reference format: " + cellReference, location);
        }
        Object dataType = field.get("data_type");
        if (!isNonEmptyString(dataType)) {
            return ValidationResult.error(fieldId, "Field must have a valid data type", location);
        }
        if (!ValueType.isSupported((String) dataType)) {
            return ValidationResult.error(fieldId, "Unsupported data type: " + dataType, location);
        }
        return ValidationResult.passed(fieldId, "Field '" + name + "' is valid", location, Map.of(
                "field_name", name,
                "cell_reference", cellReference,
                "data_type", dataType));
    }

    /**
     * Every field's data type must be a supported type name.
     */
    public ValidationResult validateDataTypes(Map<String, ?> schema) {
        List<?> fields = fields(schema);
        List<Map<String, Object>> invalidTypes = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            Map<?, ?> field = fields.get(i) instanceof Map ? (Map<?, ?>) fields.get(i) : Map.of();
            Object dataType = field.get("data_type");
            String issue = null;
            if (dataType == null || "".equals(dataType)) {
                issue = "Missing data type";
            } else if (!(dataType instanceof String)) {
                issue = "Data type must be a string";
            } else if (!ValueType.isSupported((String) dataType)) {
                issue = "Unsupported data type: " + dataType;
            }
            if (issue != null) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field_index", i);
                entry.put("field_name", fieldName(field, i));
                entry.put("data_type", dataType);
                entry.put("issue", issue);
                invalidTypes.add(entry);
            }
        }
        if (!invalidTypes.isEmpty()) {
            return ValidationResult.error("data_types", "Data type validation failed: " + invalidTypes.size()
                    + " invalid data types", "schema", Map.of("invalid_types", invalidTypes));
        }
        return ValidationResult.passed("data_types", "All data types in schema are valid", "schema",
                Map.of("field_count", fields.size()));
    }

    /**
     * Fields whose names suggest the same category (dates, counts, ...) should share one type.
     * The grouping is a name heuristic, so findings are warnings only.
     */
    public ValidationResult validateDataTypeConsistency(Map<String, ?> schema) {
        List<?> fields = fields(schema);
        Map<String, ValueType> typeByCategory = new LinkedHashMap<>();
        List<Map<String, Object>> inconsistencies = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            if (!(fields.get(i) instanceof Map)) {
                continue;
            }
            Map<?, ?> field = (Map<?, ?>) fields.get(i);
            Object dataType = field.get("data_type");
            Optional<ValueType> type = dataType instanceof String ? ValueType.fromName((String) dataType) : Optional.empty();
            Optional<String> category = fieldCategory(fieldName(field, i));
            if (type.isEmpty() || category.isEmpty()) {
                continue;
            }
            ValueType expected = typeByCategory.putIfAbsent(category.get(), type.get());
            if (expected != null && expected != type.get()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field_name", fieldName(field, i));
                entry.put("field_category", category.get());
                entry.put("actual_type", type.get().getTypeName());
                entry.put("expected_type", expected.getTypeName());
                entry.put("issue", "Inconsistent data type for field category");
                inconsistencies.add(entry);
            }
        }
        if (!inconsistencies.isEmpty()) {
            return ValidationResult.warning("data_type_consistency", "Data type consistency check found "
                    + inconsistencies.size() + " type inconsistencies", "schema",
                    Map.of("type_inconsistencies", inconsistencies));
        }
        return ValidationResult.passed("data_type_consistency", "Data types are consistent across field categories",
                "schema");
    }

    public ValidationResult validateCellReferences(Map<String, ?> schema, WorkbookHandle workbook) {
        Object tabName = schema.get("tab_name");
        if (!isNonEmptyString(tabName)) {
            return ValidationResult.error("cell_references", "Schema missing tab_name for cell reference validation",
                    "schema");
        }
        Optional<WorksheetHandle> sheet = workbook.sheet((String) tabName);
        if (sheet.isEmpty()) {
            return ValidationResult.error("cell_references", "Worksheet '" + tabName + "' not found in workbook",
                    "workbook." + tabName);
        }
        List<?> fields = fields(schema);
        List<Map<String, Object>> invalidReferences = new ArrayList<>();
        for (int i = 0; i < fields.size(); i++) {
            Map<?, ?> field = fields.get(i) instanceof Map ? (Map<?, ?>) fields.get(i) : Map.of();
            Object reference = field.get("cell_reference");
            if (reference == null || "".equals(reference)) {
                continue;
            }
            String issue = null;
            if (!CellAddress.isValid(reference.toString())) {
                issue = "Invalid cell reference format";
            } else {
                CellAddress address = CellAddress.parse(reference.toString());
                if (address.getRow() > sheet.get().maxRows() || address.getColumnIndex() > sheet.get().maxColumns()) {
                    issue = "Cell reference outside worksheet bounds";
                }
            }
            if (issue != null) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field_index", i);
                entry.put("field_name", fieldName(field, i));
                entry.put("cell_reference", reference);
                entry.put("issue", issue);
                invalidReferences.add(entry);
            }
        }
        if (!invalidReferences.isEmpty()) {
            return ValidationResult.error("cell_references", "Schema contains " + invalidReferences.size()
                    + " invalid cell references", "schema." + tabName, Map.of("invalid_references", invalidReferences));
        }
        return ValidationResult.passed("cell_references", "All cell references in schema '"
                + schema.get("schema_name") + "' are valid", "schema." + tabName, Map.of("field_count", fields.size()));
    }

    /**
     * Compares extracted tab data with the declared field types. Mismatches are warnings.
     */
    public ValidationResult validateSchemaCompatibility(Map<String, ?> schema, Map<String, ?> tabData) {
        List<?> fields = fields(schema);
        Set<String> declared = new LinkedHashSet<>();
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i) instanceof Map) {
                declared.add(fieldName((Map<?, ?>) fields.get(i), i));
            }
        }
        List<String> missing = new ArrayList<>();
        declared.stream().filter(name -> !tabData.containsKey(name)).forEach(missing::add);
        if (!missing.isEmpty()) {
            return ValidationResult.error("schema_compatibility", "Schema fields missing from tab data: " + missing,
                    "schema", Map.of("missing_fields", missing, "available_fields", new ArrayList<>(tabData.keySet())));
        }

        List<Map<String, Object>> issues = new ArrayList<>();
        for (Object item : fields) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<?, ?> field = (Map<?, ?>) item;
            Object name = field.get("name");
            Object dataType = field.get("data_type");
            Object value = tabData.get(String.valueOf(name));
            if (value != null && dataType instanceof String && !isCompatible(value, (String) dataType)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field_name", name);
                entry.put("expected_type", dataType);
                entry.put("actual_value", value.toString());
                entry.put("issue", "Value type incompatible with schema definition");
                issues.add(entry);
            }
        }
        if (!issues.isEmpty()) {
            return ValidationResult.warning("schema_compatibility", "Schema contains " + issues.size()
                    + " type compatibility issues", "schema", Map.of("type_compatibility_issues", issues));
        }
        return ValidationResult.passed("schema_compatibility", "Schema is compatible with tab data", "schema",
                Map.of("field_count", fields.size(), "compatible_fields", fields.size()));
    }

    static Optional<String> fieldCategory(String fieldName) {
        String lower = fieldName.toLowerCase(Locale.ROOT);
        return FIELD_CATEGORIES.entrySet().stream()
                .filter(group -> group.getValue().stream().anyMatch(lower::contains))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    static boolean isCompatible(Object value, String dataType) {
        Optional<ValueType> type = ValueType.fromName(dataType);
        if (type.isEmpty()) {
            return true;
        }
        if (type.get().isTemporal()) {
            return value instanceof Temporal || value instanceof String;
        }
        switch (type.get()) {
            case STRING:
                return value instanceof String;
            case INTEGER:
                if (value instanceof Long || value instanceof Integer || value instanceof Short) {
                    return true;
                }
                return value instanceof Double && ((Double) value) == Math.rint((Double) value);
            case FLOAT:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean;
            case EMAIL:
            case URL:
                return value instanceof String && !((String) value).isEmpty();
            default:
                return true;
        }
    }

    private static List<?> fields(Map<String, ?> schema) {
        Object fields = schema == null ? null : schema.get("fields");
        return fields instanceof List ? (List<?>) fields : List.of();
    }

    private static String fieldName(Map<?, ?> field, int index) {
        Object name = field.get("name");
        return name == null ? "field_" + index : name.toString();
    }

    private static boolean isNonEmptyString(Object value) {
        return value instanceof String && !((String) value).isEmpty();
    }
}
