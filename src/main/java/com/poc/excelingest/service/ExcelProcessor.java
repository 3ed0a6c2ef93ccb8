package com.poc.excelingest.service;

import com.poc.excelingest.coerce.CellValueCoercer;
import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.ExcelProcessingException;
import com.poc.excelingest.exception.FileException;
import com.poc.excelingest.exception.ProcessingException;
import com.poc.excelingest.exception.SchemaException;
import com.poc.excelingest.extract.CompoundFieldSplitter;
import com.poc.excelingest.extract.TabExtractor;
import com.poc.excelingest.model.ExcelParseResult;
import com.poc.excelingest.model.ParsedWorkbook;
import com.poc.excelingest.model.ProcessingStats;
import com.poc.excelingest.model.Schema;
import com.poc.excelingest.model.SchemaRegistry;
import com.poc.excelingest.model.TabResult;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.parse.ParseOutcome;
import com.poc.excelingest.parse.WorkbookParser;
import com.poc.excelingest.scan.KeyValueRegionScanner;
import com.poc.excelingest.schema.SchemaDefinitions;
import com.poc.excelingest.schema.SchemaResolver;
import com.poc.excelingest.util.CellAddress;
import com.poc.excelingest.validation.DataValidationRules;
import com.poc.excelingest.validation.DataValidator;
import com.poc.excelingest.validation.FileValidator;
import com.poc.excelingest.validation.SchemaValidator;
import com.poc.excelingest.validation.ValidationAggregator;
import com.poc.excelingest.workbook.PoiWorkbookLoader;
import com.poc.excelingest.workbook.WorkbookHandle;
import com.poc.excelingest.workbook.WorkbookLoader;
import com.poc.excelingest.workbook.WorksheetHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the ingest core: validates, parses and checks one workbook file per call.
 * <p>
 * Every call owns its statistics and result lists; the only shared state is the read-only schema registry,
 * so concurrent calls on different files do not interfere.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelProcessor {

    private final ExcelParseConfig config;
    private final SchemaRegistry registry;
    private final WorkbookLoader loader;
    private final WorkbookParser parser;
    private final TabExtractor tabExtractor;
    private final ValidationAggregator validationAggregator;

    /**
     * Wires the standard POI-backed components.
     */
    public static ExcelProcessor withDefaults(ExcelParseConfig config, SchemaRegistry registry) {
        WorkbookLoader loader = new PoiWorkbookLoader();
        SchemaResolver resolver = new SchemaResolver();
        CellValueCoercer coercer = new CellValueCoercer();
        TabExtractor extractor = new TabExtractor(resolver, coercer, new CompoundFieldSplitter());
        WorkbookParser parser = new WorkbookParser(loader, new KeyValueRegionScanner(), extractor, resolver);
        ValidationAggregator aggregator = new ValidationAggregator(new FileValidator(config, loader),
                new SchemaValidator(), new DataValidator(coercer), config);
        return new ExcelProcessor(config, registry, loader, parser, extractor, aggregator);
    }

    public ExcelParseResult processFile(Path path) {
        return processFile(path, List.of(), Map.of(), Map.of());
    }

    public ExcelParseResult processFile(Path path, List<String> requiredTabs,
                                        Map<String, ? extends Map<String, ?>> schemas) {
        return processFile(path, requiredTabs, schemas, Map.of());
    }

    /**
     * Runs file checks, opens the workbook, checks its structure and the given raw schema definitions,
     * parses it and finally runs the data checks.
     *
     * @param requiredTabs tabs that must exist, may be empty
     * @param schemas      raw field-list schema definitions keyed by tab name; they take precedence over the
     *                     workbook's own schema map for those tabs
     * @param rules        data checks keyed by tab name
     */
    public ExcelParseResult processFile(Path path, List<String> requiredTabs,
                                        Map<String, ? extends Map<String, ?>> schemas,
                                        Map<String, DataValidationRules> rules) {
        ProcessingStats stats = new ProcessingStats();
        stats.startTiming();
        long started = System.nanoTime();
        List<ValidationResult> results = new ArrayList<>();
        log.info("Starting Excel file processing: {}", path);

        results.addAll(validationAggregator.checkFile(path));
        if (!validationAggregator.shouldContinue(results)) {
            return failed(path, results, stats, started, "File validation failed");
        }

        WorkbookHandle workbook;
        try {
            workbook = loader.open(path);
        } catch (FileException e) {
            log.error("Failed to load workbook: {}, error: {}", path, e.getMessage());
            results.add(ValidationResult.error("workbook_loading", "Failed to load workbook: " + e.getMessage(),
                    String.valueOf(path), e.toMap()));
            return failed(path, results, stats, started, "Failed to load workbook");
        }

        try {
            results.addAll(validationAggregator.checkWorkbook(workbook, requiredTabs));
            results.addAll(validationAggregator.checkSchemas(schemas, workbook));

            SchemaRegistry callRegistry = registry;
            Map<String, String> overrides = new LinkedHashMap<>();
            if (schemas != null && !schemas.isEmpty()) {
                callRegistry = withCallSchemas(schemas, overrides, results);
            }

            ParseOutcome outcome = parser.parse(workbook, callRegistry, config, stats, overrides);
            results.addAll(outcome.getValidationResults());
            ParsedWorkbook parsed = outcome.getWorkbook();
            results.addAll(validationAggregator.checkData(parsed, schemas, rules));

            boolean success = validationAggregator.isSuccessful(results);
            log.info("Excel file processing completed: {} (success={}, tabs={})", path, success,
                    parsed.getTabContents().size());
            return finish(success, path, parsed, results, stats, started, List.of());
        } catch (ExcelProcessingException e) {
            log.error("Excel file processing failed: {}, error: {}", path, e.getMessage());
            stats.recordError(ProcessingStats.ErrorKind.PROCESSING);
            return failed(path, results, stats, started, "Processing error: " + e.getMessage());
        } finally {
            workbook.close();
        }
    }

    /**
     * Converts call-supplied definitions into schemas layered over the shared registry.
     * Definitions that do not convert are reported and left out.
     */
    private SchemaRegistry withCallSchemas(Map<String, ? extends Map<String, ?>> schemas, Map<String, String> overrides,
                                           List<ValidationResult> results) {
        Map<String, Schema> merged = new LinkedHashMap<>(registry.getSchemas());
        schemas.forEach((tab, definition) -> {
            try {
                Schema schema = SchemaDefinitions.fromDefinition(definition);
                merged.put(schema.getSchemaName(), schema);
                overrides.put(tab, schema.getSchemaName());
            } catch (SchemaException e) {
                log.warn("Schema for tab '{}' cannot be used: {}", tab, e.getMessage());
                results.add(ValidationResult.error("schema_validation", "Schema validation error: " + e.getMessage(),
                        "schema." + tab, e.toMap()));
            }
        });
        return new SchemaRegistry(merged, registry.getAliases());
    }

    /**
     * Reads one tab. With a schema the declared fields are extracted; without one every non-empty cell
     * of the used range is returned keyed by its address.
     *
     * @throws ProcessingException if the tab does not exist or cannot be read
     */
    public TabResult processTab(WorkbookHandle workbook, String tabName, Schema schema) {
        WorksheetHandle sheet = workbook.sheet(tabName).orElseThrow(() -> new ProcessingException(
                "Tab '" + tabName + "' not found in workbook", ErrorCode.PROCESSING_FAILED,
                Map.of("tab_name", tabName, "available_tabs", workbook.sheetNames())));
        try {
            if (schema != null) {
                return tabExtractor.extractTab(sheet, schema, config, new ProcessingStats());
            }
            return extractTabDefault(sheet);
        } catch (ExcelProcessingException e) {
            log.error("Tab processing failed: {}, error: {}", tabName, e.getMessage());
            throw new ProcessingException("Failed to process tab '" + tabName + "': " + e.getMessage(),
                    ErrorCode.PROCESSING_FAILED, Map.of("tab_name", tabName), e);
        }
    }

    private TabResult extractTabDefault(WorksheetHandle sheet) {
        Map<String, Object> data = new LinkedHashMap<>();
        List<ValidationResult> results = new ArrayList<>();
        int minRow = Math.max(sheet.firstRow(), 1);
        int maxRow = Math.max(sheet.lastRow(), 1);
        int minCol = Math.max(sheet.firstColumn(), 1);
        int maxCol = Math.max(sheet.lastColumn(), 1);

        int rowLimit = Math.min(maxRow, minRow + config.getMaxRows() - 1);
        int colLimit = Math.min(maxCol, minCol + config.getMaxColumns() - 1);
        if (rowLimit < maxRow || colLimit < maxCol) {
            results.add(ValidationResult.warning("used_range", "Used range of '" + sheet.name()
                    + "' exceeds the configured limits, reading " + (rowLimit - minRow + 1) + " rows and "
                    + (colLimit - minCol + 1) + " columns", sheet.name(),
                    Map.of("max_rows", config.getMaxRows(), "max_columns", config.getMaxColumns())));
        }

        for (int row = minRow; row <= rowLimit; row++) {
            for (int col = minCol; col <= colLimit; col++) {
                CellAddress address = CellAddress.of(col, row);
                Object value = sheet.getCell(address);
                if (value != null) {
                    data.put(address.toString(), value);
                }
            }
        }
        Map<String, Integer> range = new LinkedHashMap<>();
        range.put("min_row", minRow);
        range.put("max_row", maxRow);
        range.put("min_col", minCol);
        range.put("max_col", maxCol);
        return new TabResult(sheet.name(), null, data, results, range);
    }

    private ExcelParseResult failed(Path path, List<ValidationResult> results, ProcessingStats stats, long started,
                                    String fatalError) {
        return finish(false, path, null, results, stats, started, List.of(fatalError));
    }

    private ExcelParseResult finish(boolean success, Path path, ParsedWorkbook workbook, List<ValidationResult> results,
                                    ProcessingStats stats, long started, List<String> fatalErrors) {
        stats.recordResults(results);
        stats.endTiming();
        return ExcelParseResult.builder()
                .success(success)
                .workbook(workbook)
                .validationResults(results)
                .processingStats(stats)
                .fatalErrors(fatalErrors)
                .filePath(path)
                .fileChecksum(checksum(path))
                .processingTime((System.nanoTime() - started) / 1_000_000_000.0)
                .build();
    }

    private static String checksum(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return null;
        }
        try (InputStream in = Files.newInputStream(path)) {
            return DigestUtils.sha256Hex(in);
        } catch (IOException e) {
            log.warn("Could not compute checksum of {}: {}", path, e.getMessage());
            return null;
        }
    }
}
