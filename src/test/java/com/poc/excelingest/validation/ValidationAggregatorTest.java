package com.poc.excelingest.validation;

import com.poc.excelingest.coerce.CellValueCoercer;
import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.model.ParsedWorkbook;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.support.InMemoryWorkbook;
import com.poc.excelingest.workbook.PoiWorkbookLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationAggregatorTest {

    private static ValidationAggregator aggregator(boolean strict) {
        ExcelParseConfig config = ExcelParseConfig.builder().strictMode(strict).build();
        return new ValidationAggregator(new FileValidator(config, new PoiWorkbookLoader()), new SchemaValidator(),
                new DataValidator(new CellValueCoercer()), config);
    }

    private final List<ValidationResult> withError = List.of(
            ValidationResult.passed("file_path", "ok", "x"),
            ValidationResult.error("file_size", "too big", "x"));
    private final List<ValidationResult> withWarning = List.of(
            ValidationResult.warning("data_type_consistency", "odd", "schema", Map.of()));

    @Test
    @DisplayName("errors only fail the run in strict mode")
    void strictModeDecides() {
        assertThat(aggregator(true).isSuccessful(withError)).isFalse();
        assertThat(aggregator(true).shouldContinue(withError)).isFalse();
        assertThat(aggregator(false).isSuccessful(withError)).isTrue();
    }

    @Test
    @DisplayName("warnings never fail the run")
    void warningsNeverFail() {
        assertThat(aggregator(true).isSuccessful(withWarning)).isTrue();
        assertThat(ValidationAggregator.hasErrors(withWarning)).isFalse();
        assertThat(ValidationAggregator.hasErrors(withError)).isTrue();
    }

    @Test
    @DisplayName("every raw schema is checked against the workbook")
    void checkSchemas() {
        InMemoryWorkbook workbook = new InMemoryWorkbook();
        workbook.addSheet("Site");
        Map<String, Map<String, Object>> schemas = Map.of("Site", Map.of(
                "schema_name", "site_v1", "tab_name", "Site",
                "fields", List.of(Map.of("name", "site_name", "cell_reference", "B2", "data_type", "str"))));

        List<ValidationResult> results = aggregator(false).checkSchemas(schemas, workbook);

        assertThat(results).hasSize(5).allMatch(ValidationResult::isValid);
        assertThat(aggregator(false).checkSchemas(null, workbook)).isEmpty();
    }

    @Test
    @DisplayName("data checks cover schema compatibility and tab rules for extracted tabs only")
    void checkData() {
        ParsedWorkbook parsed = new ParsedWorkbook(Map.of(), Map.of("Site", "site_v1"),
                Map.of("Site", Map.of("site_name", "North")));
        Map<String, Map<String, Object>> schemas = Map.of("Site", Map.of(
                "schema_name", "site_v1", "tab_name", "Site",
                "fields", List.of(Map.of("name", "site_name", "cell_reference", "B2", "data_type", "str"))));
        Map<String, DataValidationRules> rules = Map.of(
                "Site", DataValidationRules.builder().requiredField("site_name").build(),
                "Absent", DataValidationRules.builder().requiredField("x").build());

        List<ValidationResult> results = aggregator(false).checkData(parsed, schemas, rules);

        assertThat(results).extracting(ValidationResult::getFieldName)
                .containsExactly("schema_compatibility", "required_fields");
        assertThat(results).allMatch(ValidationResult::isValid);
    }
}
