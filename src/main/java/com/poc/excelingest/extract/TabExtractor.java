package com.poc.excelingest.extract;

import com.poc.excelingest.coerce.CellValueCoercer;
import com.poc.excelingest.coerce.CoercionResult;
import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.model.FieldDefinition;
import com.poc.excelingest.model.ProcessingStats;
import com.poc.excelingest.model.Schema;
import com.poc.excelingest.model.SchemaRegistry;
import com.poc.excelingest.model.Severity;
import com.poc.excelingest.model.TabResult;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.schema.SchemaResolver;
import com.poc.excelingest.util.CellAddress;
import com.poc.excelingest.util.UnicodeSanitizer;
import com.poc.excelingest.workbook.WorkbookHandle;
import com.poc.excelingest.workbook.WorksheetHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads the fields of schema-described tabs into flat name/value maps.
 * <p>
 * A tab whose schema cannot be resolved, or whose worksheet is missing, is left out of the result
 * and reported; the remaining tabs are still extracted. Field-level problems never drop a tab.
 */
@Slf4j
public class TabExtractor {

    private final SchemaResolver schemaResolver;
    private final CellValueCoercer coercer;
    private final CompoundFieldSplitter splitter;

    public TabExtractor(SchemaResolver schemaResolver, CellValueCoercer coercer, CompoundFieldSplitter splitter) {
        this.schemaResolver = schemaResolver;
        this.coercer = coercer;
        this.splitter = splitter;
    }

    /**
     * Extracts every tab named in {@code schemaMap} (tab name to schema name or alias).
     *
     * @throws com.poc.excelingest.exception.DataException if a compound field is malformed
     */
    public ExtractionOutcome extract(WorkbookHandle workbook, Map<String, String> schemaMap, SchemaRegistry registry,
                                     ExcelParseConfig config, ProcessingStats stats) {
        Map<String, Map<String, Object>> tabContents = new LinkedHashMap<>();
        Map<String, String> schemasUsed = new LinkedHashMap<>();
        List<ValidationResult> results = new ArrayList<>();
        Severity skipSeverity = config.isSkipInvalidTabs() ? Severity.WARNING : Severity.ERROR;

        for (Map.Entry<String, String> entry : schemaMap.entrySet()) {
            String tabName = entry.getKey();
            String schemaName = entry.getValue();
            log.debug("Extracting data from '{}' using schema '{}'", tabName, schemaName);

            Optional<Schema> schema = schemaResolver.resolve(schemaName, registry);
            if (schema.isEmpty()) {
                log.warn("Schema '{}' for tab '{}' is not registered, skipping tab", schemaName, tabName);
                Map<String, Object> context = new LinkedHashMap<>();
                context.put("tab_name", tabName);
                context.put("schema_name", schemaName);
                context.put("available_schemas", new ArrayList<>(registry.getSchemaNames()));
                context.put("error_code", ErrorCode.SCHEMA_NOT_FOUND.name());
                results.add(new ValidationResult("schema_resolution", false,
                        "Schema '" + schemaName + "' for tab '" + tabName + "' not found", skipSeverity, tabName, context));
                continue;
            }

            Optional<WorksheetHandle> sheet = workbook.sheet(tabName);
            if (sheet.isEmpty()) {
                log.warn("Tab '{}' is declared in the schema map but missing from the workbook", tabName);
                results.add(new ValidationResult("tab_presence", false,
                        "Tab '" + tabName + "' not found in workbook", skipSeverity, tabName,
                        Map.of("tab_name", tabName, "available_tabs", workbook.sheetNames())));
                continue;
            }

            TabResult tab = extractTab(sheet.get(), schema.get(), config, stats);
            tabContents.put(tabName, tab.getData());
            schemasUsed.put(tabName, schema.get().getSchemaName());
            results.addAll(tab.getValidationResults());
            stats.incrementTabs(1);
        }
        return new ExtractionOutcome(tabContents, schemasUsed, results);
    }

    /**
     * Extracts one worksheet against a schema.
     *
     * @throws com.poc.excelingest.exception.DataException if a compound field is malformed
     */
    public TabResult extractTab(WorksheetHandle sheet, Schema schema, ExcelParseConfig config, ProcessingStats stats) {
        Map<String, Object> data = new LinkedHashMap<>();
        List<ValidationResult> results = new ArrayList<>();
        List<FieldDefinition> fields = schema.getFields();

        if (fields.size() > config.getMaxFieldCount()) {
            results.add(ValidationResult.error("field_count",
                    "Schema '" + schema.getSchemaName() + "' declares " + fields.size()
                            + " fields, only the first " + config.getMaxFieldCount() + " are read",
                    sheet.name(), Map.of("field_count", fields.size(), "max_field_count", config.getMaxFieldCount())));
            fields = fields.subList(0, config.getMaxFieldCount());
        }

        for (FieldDefinition field : fields) {
            data.put(field.getName(), readField(sheet, field, config, results));
            stats.incrementFields(1);
            stats.incrementCells(1);
            verifyLabel(sheet, field, config, results);
        }
        log.debug("Initial extraction of '{}' yields {}", sheet.name(), data);

        splitter.split(data);
        return new TabResult(sheet.name(), schema.getSchemaName(), data, results);
    }

    private Object readField(WorksheetHandle sheet, FieldDefinition field, ExcelParseConfig config,
                             List<ValidationResult> results) {
        CellAddress address = field.getCellAddress();
        String location = sheet.name() + "!" + address;
        if (address.getRow() > sheet.maxRows() || address.getColumnIndex() > sheet.maxColumns()) {
            results.add(ValidationResult.error(field.getName(),
                    "Cell " + address + " is outside the worksheet bounds", location,
                    Map.of("max_rows", sheet.maxRows(), "max_columns", sheet.maxColumns(),
                            "error_code", ErrorCode.INVALID_CELL_REFERENCE.name())));
            return field.defaultValue();
        }

        Object raw = clean(sheet.getCell(address), config);
        if (raw == null || "".equals(raw)) {
            return missingValue(field, location, config, results);
        }

        CoercionResult coerced = coercer.coerce(raw, field.getValueType());
        if (coerced.isValid()) {
            return coerced.getValue();
        }
        log.warn("Field '{}' at {} holds '{}' which is not a valid {}", field.getName(), location, raw,
                field.getValueType().getTypeName());
        Map<String, Object> context = new LinkedHashMap<>(coerced.getContext());
        context.put("value_address", field.getValueAddress());
        results.add(ValidationResult.error(field.getName(), coerced.getMessage(), location, context));
        // Drop-downs fall back to the placeholder, free-form fields keep what the user typed
        return field.isDropDown() ? FieldDefinition.PLEASE_SELECT : raw;
    }

    private Object missingValue(FieldDefinition field, String location, ExcelParseConfig config,
                                List<ValidationResult> results) {
        switch (config.getMissingValuePolicy()) {
            case NULL:
                return null;
            case ERROR:
                results.add(ValidationResult.error(field.getName(), "Field '" + field.getName() + "' has no value",
                        location, Map.of("value_address", field.getValueAddress(),
                                "error_code", ErrorCode.REQUIRED_FIELD_MISSING.name())));
                return field.defaultValue();
            case SKIP:
            default:
                return field.defaultValue();
        }
    }

    private void verifyLabel(WorksheetHandle sheet, FieldDefinition field, ExcelParseConfig config,
                             List<ValidationResult> results) {
        if (field.getLabel() == null || field.getLabelAddress() == null) {
            return;
        }
        Object actual = clean(sheet.getCell(field.getLabelAddress()), config);
        if (!Objects.equals(field.getLabel(), actual)) {
            log.warn("Schema label and spreadsheet label differ for '{}': schema = '{}', spreadsheet ({}) = '{}'",
                    field.getName(), field.getLabel(), field.getLabelAddress(), actual);
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("expected_label", field.getLabel());
            context.put("actual_label", actual);
            results.add(ValidationResult.warning(field.getName(), "Label at " + field.getLabelAddress()
                    + " does not match the schema label", sheet.name() + "!" + field.getLabelAddress(), context));
        }
    }

    private static Object clean(Object value, ExcelParseConfig config) {
        if (!(value instanceof String)) {
            return value;
        }
        String text = UnicodeSanitizer.sanitize((String) value);
        return config.isTrimStrings() ? text.trim() : text;
    }
}
