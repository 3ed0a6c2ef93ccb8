package com.poc.excelingest.validation;

import com.poc.excelingest.model.Severity;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.support.InMemoryWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    private static Map<String, Object> field(String name, String reference, String type) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("name", name);
        field.put("cell_reference", reference);
        field.put("data_type", type);
        return field;
    }

    private static Map<String, Object> schema(Object... fields) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("schema_name", "site_v1");
        schema.put("tab_name", "Site");
        schema.put("fields", List.of(fields));
        return schema;
    }

    @Test
    @DisplayName("a well-formed schema passes every check")
    void validSchema() {
        InMemoryWorkbook workbook = new InMemoryWorkbook();
        workbook.addSheet("Site");

        List<ValidationResult> results = validator.validateSchema(
                schema(field("site_name", "B2", "string"), field("visit_count", "$B$3", "int")), workbook);

        assertThat(results).extracting(ValidationResult::getFieldName).containsExactly(
                "schema_structure", "field_definitions", "data_types", "data_type_consistency", "cell_references");
        assertThat(results).allMatch(ValidationResult::isValid);
    }

    @Test
    @DisplayName("missing top-level keys stop further checks")
    void missingKeys() {
        List<ValidationResult> results = validator.validateSchema(Map.of("schema_name", "x"), null);

        assertThat(results).singleElement().satisfies(result -> {
            assertThat(result.getFieldName()).isEqualTo("schema_structure");
            assertThat(result.getContext()).containsEntry("missing_fields", List.of("fields", "tab_name"));
        });
    }

    @Test
    @DisplayName("field definitions report the first problem of each field")
    void fieldDefinitionProblems() {
        assertThat(validator.validateFieldDefinition("text", 0).getMessage()).contains("must be a dictionary");
        assertThat(validator.validateFieldDefinition(Map.of("name", "a"), 1).getMessage())
                .contains("missing required properties");
        assertThat(validator.validateFieldDefinition(field("a", "1B", "string"), 2).getMessage())
                .isEqualTo("Invalid cell reference format: 1B");
        assertThat(validator.validateFieldDefinition(field("a", "B1", "blob"), 3).getMessage())
                .isEqualTo("Unsupported data type: blob");
        assertThat(validator.validateFieldDefinition(field("a", "B1", "float"), 4).getLocation())
                .isEqualTo("schema.fields[4]");
    }

    @Test
    @DisplayName("invalid fields make the definition check fail")
    void invalidFieldFailsDefinition() {
        ValidationResult result = validator.validateSchemaDefinition(schema(field("a", "B1", "blob")));

        assertThat(result.isValid()).isFalse();
        assertThat(result.getFieldName()).isEqualTo("schema_fields");
    }

    @Test
    @DisplayName("unsupported data types are collected")
    void dataTypes() {
        Map<String, Object> schema = schema(field("a", "B1", "string"), field("b", "B2", "blob"));

        ValidationResult result = validator.validateDataTypes(schema);

        assertThat(result.isError()).isTrue();
        assertThat(result.getMessage()).isEqualTo("Data type validation failed: 1 invalid data types");
    }

    @Test
    @DisplayName("fields of one name category with different types give a warning")
    void consistencyWarning() {
        Map<String, Object> schema = schema(field("start_date", "B1", "datetime"), field("end_date", "B2", "string"));

        ValidationResult result = validator.validateDataTypeConsistency(schema);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    @DisplayName("type aliases count as the same type")
    void consistencyUsesCanonicalTypes() {
        Map<String, Object> schema = schema(field("start_date", "B1", "datetime"),
                field("end_date", "B2", "datetime.datetime"));

        assertThat(validator.validateDataTypeConsistency(schema).isValid()).isTrue();
    }

    @Test
    @DisplayName("cell references outside the sheet are reported")
    void cellReferencesOutOfBounds() {
        InMemoryWorkbook workbook = new InMemoryWorkbook();
        workbook.addSheet("Site", 100, 10);

        ValidationResult result = validator.validateCellReferences(
                schema(field("a", "B2", "string"), field("b", "Z500", "string")), workbook);

        assertThat(result.isValid()).isFalse();
        assertThat(result.getMessage()).isEqualTo("Schema contains 1 invalid cell references");
    }

    @Test
    @DisplayName("a schema whose tab is missing fails the reference check")
    void cellReferencesMissingTab() {
        assertThat(validator.validateCellReferences(schema(field("a", "B2", "string")), new InMemoryWorkbook())
                .getMessage()).isEqualTo("Worksheet 'Site' not found in workbook");
    }

    @Test
    @DisplayName("extracted data missing a field is an error, wrong types are warnings")
    void compatibility() {
        Map<String, Object> schema = schema(field("site_name", "B1", "string"), field("visits", "B2", "int"),
                field("visited_on", "B3", "date"));

        ValidationResult missing = validator.validateSchemaCompatibility(schema, Map.of("site_name", "A"));
        ValidationResult mistyped = validator.validateSchemaCompatibility(schema,
                Map.of("site_name", "A", "visits", 2.5, "visited_on", LocalDateTime.now()));
        ValidationResult fine = validator.validateSchemaCompatibility(schema,
                Map.of("site_name", "A", "visits", 2L, "visited_on", "2025-01-01"));

        assertThat(missing.isError()).isTrue();
        assertThat(mistyped.isWarning()).isTrue();
        assertThat(fine.isValid()).isTrue();
    }

    @Test
    @DisplayName("temporal types accept dates and date text but not numbers")
    void temporalCompatibility() {
        assertThat(SchemaValidator.isCompatible(LocalDateTime.of(2025, 1, 1, 0, 0), "datetime")).isTrue();
        assertThat(SchemaValidator.isCompatible("2025-01-01", "date")).isTrue();
        assertThat(SchemaValidator.isCompatible(45000.0, "time")).isFalse();
        assertThat(SchemaValidator.isCompatible(45000.0, "float")).isTrue();
    }

    @Test
    @DisplayName("field names map to categories by keyword")
    void categories() {
        assertThat(SchemaValidator.fieldCategory("facility_name")).contains("text");
        assertThat(SchemaValidator.fieldCategory("observation_timestamp")).contains("datetime");
        assertThat(SchemaValidator.fieldCategory("contact_email")).contains("contact");
        assertThat(SchemaValidator.fieldCategory("lat_arb")).isEmpty();
    }
}
