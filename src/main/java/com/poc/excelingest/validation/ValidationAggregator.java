package com.poc.excelingest.validation;

import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.model.ParsedWorkbook;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.workbook.WorkbookHandle;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the four check groups (file, workbook, schema, data) and decides what the results mean for the run.
 * The groups are independent; the only short circuit is a failed file check in strict mode.
 */
@Slf4j
public class ValidationAggregator {

    private final FileValidator fileValidator;
    private final SchemaValidator schemaValidator;
    private final DataValidator dataValidator;
    private final ExcelParseConfig config;

    public ValidationAggregator(FileValidator fileValidator, SchemaValidator schemaValidator,
                                DataValidator dataValidator, ExcelParseConfig config) {
        this.fileValidator = fileValidator;
        this.schemaValidator = schemaValidator;
        this.dataValidator = dataValidator;
        this.config = config;
    }

    public List<ValidationResult> checkFile(Path path) {
        return logged(fileValidator.validateFile(path));
    }

    public List<ValidationResult> checkWorkbook(WorkbookHandle workbook, List<String> requiredTabs) {
        return logged(fileValidator.validateWorkbook(workbook, requiredTabs));
    }

    /**
     * Validates raw schema definitions keyed by tab name against the open workbook.
     */
    public List<ValidationResult> checkSchemas(Map<String, ? extends Map<String, ?>> schemas, WorkbookHandle workbook) {
        List<ValidationResult> results = new ArrayList<>();
        if (schemas == null) {
            return results;
        }
        schemas.forEach((tab, schema) -> results.addAll(schemaValidator.validateSchema(schema, workbook)));
        return logged(results);
    }

    /**
     * Compatibility of extracted data with each raw schema definition, then the configured data rules per tab.
     */
    public List<ValidationResult> checkData(ParsedWorkbook workbook, Map<String, ? extends Map<String, ?>> schemas,
                                            Map<String, DataValidationRules> rules) {
        List<ValidationResult> results = new ArrayList<>();
        Map<String, Map<String, Object>> contents = workbook.getTabContents();
        if (schemas != null) {
            schemas.forEach((tab, schema) -> {
                if (contents.containsKey(tab)) {
                    results.add(schemaValidator.validateSchemaCompatibility(schema, contents.get(tab)));
                }
            });
        }
        if (rules != null) {
            rules.forEach((tab, tabRules) -> {
                if (contents.containsKey(tab)) {
                    results.addAll(dataValidator.validateTab(tab, contents.get(tab), tabRules));
                } else {
                    log.debug("No extracted content for tab '{}', data rules skipped", tab);
                }
            });
        }
        return logged(results);
    }

    /**
     * False only in strict mode when a check has failed with error severity.
     */
    public boolean shouldContinue(List<ValidationResult> results) {
        return isSuccessful(results);
    }

    /**
     * Warnings and info never affect success; errors only do in strict mode.
     */
    public boolean isSuccessful(List<ValidationResult> results) {
        return !config.isStrictMode() || !hasErrors(results);
    }

    public static boolean hasErrors(List<ValidationResult> results) {
        return results.stream().anyMatch(result -> !result.isValid() && result.isError());
    }

    private static List<ValidationResult> logged(List<ValidationResult> results) {
        for (ValidationResult result : results) {
            if (result.isValid()) {
                log.debug("Validation passed: {}", result.getFieldName());
            } else {
                log.warn("Validation failed: {}: {}", result.getFieldName(), result.getMessage());
            }
        }
        return results;
    }
}
