package com.poc.excelingest.parse;

import com.poc.excelingest.config.ExcelParseConfig;
import com.poc.excelingest.exception.FileException;
import com.poc.excelingest.extract.ExtractionOutcome;
import com.poc.excelingest.extract.TabExtractor;
import com.poc.excelingest.model.ParsedWorkbook;
import com.poc.excelingest.model.ProcessingStats;
import com.poc.excelingest.model.SchemaRegistry;
import com.poc.excelingest.model.ValidationResult;
import com.poc.excelingest.scan.KeyValueRegionScanner;
import com.poc.excelingest.schema.SchemaResolver;
import com.poc.excelingest.workbook.WorkbookHandle;
import com.poc.excelingest.workbook.WorkbookLoader;
import com.poc.excelingest.workbook.WorksheetHandle;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a workbook that follows the hidden-tab convention into a {@link ParsedWorkbook}.
 * <p>
 * {@value #METADATA_TAB} holds top-level key/value pairs (sector, schema version, ...) and
 * {@value #SCHEMA_TAB} maps each content tab to the schema that describes it. Both regions start at
 * {@value #TOP_LEFT_CELL}.
 */
@Slf4j
public class WorkbookParser {

    public static final String METADATA_TAB = "_json_metadata";
    public static final String SCHEMA_TAB = "_json_schema";
    public static final String TOP_LEFT_CELL = "$B$15";

    private final WorkbookLoader loader;
    private final KeyValueRegionScanner scanner;
    private final TabExtractor tabExtractor;
    private final SchemaResolver schemaResolver;

    public WorkbookParser(WorkbookLoader loader, KeyValueRegionScanner scanner, TabExtractor tabExtractor,
                          SchemaResolver schemaResolver) {
        this.loader = loader;
        this.scanner = scanner;
        this.tabExtractor = tabExtractor;
        this.schemaResolver = schemaResolver;
    }

    /**
     * Opens the file, parses it and closes it again. An unopenable file ends in {@link ParseStage#FAILED_AT_OPEN}
     * with a single error result.
     */
    public ParseOutcome parse(Path path, SchemaRegistry registry, ExcelParseConfig config, ProcessingStats stats) {
        log.debug("Stage {}: {}", ParseStage.OPEN, path);
        WorkbookHandle handle;
        try {
            handle = loader.open(path);
        } catch (FileException e) {
            log.error("Failed to open workbook {}: {}", path, e.getMessage());
            return ParseOutcome.failedAtOpen(ValidationResult.error("workbook_loading",
                    "Failed to load workbook: " + e.getMessage(), String.valueOf(path), e.toMap()));
        }
        try {
            return parse(handle, registry, config, stats);
        } finally {
            handle.close();
        }
    }

    /**
     * Parses an already open workbook. The caller owns the handle.
     *
     * @throws com.poc.excelingest.exception.DataException if a compound field is malformed
     */
    public ParseOutcome parse(WorkbookHandle workbook, SchemaRegistry registry, ExcelParseConfig config,
                              ProcessingStats stats) {
        return parse(workbook, registry, config, stats, Map.of());
    }

    /**
     * As {@link #parse(WorkbookHandle, SchemaRegistry, ExcelParseConfig, ProcessingStats)}, with
     * {@code schemaOverrides} (tab name to schema name) taking precedence over the workbook's own schema map.
     */
    public ParseOutcome parse(WorkbookHandle workbook, SchemaRegistry registry, ExcelParseConfig config,
                              ProcessingStats stats, Map<String, String> schemaOverrides) {
        List<ValidationResult> results = new ArrayList<>();

        log.debug("Stage {}", ParseStage.READ_METADATA);
        Map<String, Object> metadata = new LinkedHashMap<>();
        Optional<WorksheetHandle> metadataSheet = workbook.sheet(METADATA_TAB);
        if (metadataSheet.isPresent()) {
            metadata.putAll(scanner.scan(metadataSheet.get(), TOP_LEFT_CELL, config.getMaxRows()));
            stats.incrementRows(metadata.size());
        } else {
            log.debug("No {} tab in workbook", METADATA_TAB);
        }
        metadata.putIfAbsent("workbook_properties", workbook.properties());
        metadata.putIfAbsent("total_tabs", workbook.sheetNames().size());
        metadata.putIfAbsent("tab_names", workbook.sheetNames());

        log.debug("Stage {}", ParseStage.READ_SCHEMA_MAP);
        Map<String, String> schemaMap = new LinkedHashMap<>();
        Optional<WorksheetHandle> schemaSheet = workbook.sheet(SCHEMA_TAB);
        if (schemaSheet.isPresent()) {
            Map<String, Object> region = scanner.scan(schemaSheet.get(), TOP_LEFT_CELL, config.getMaxRows());
            region.forEach((tab, schema) -> schemaMap.put(tab, schema == null ? null : schema.toString()));
            stats.incrementRows(region.size());
        } else {
            log.warn("Workbook has no {} tab", SCHEMA_TAB);
            results.add(ValidationResult.warning(SCHEMA_TAB, "Workbook has no " + SCHEMA_TAB + " tab",
                    "workbook", Map.of("tab_names", workbook.sheetNames())));
        }

        schemaMap.putAll(schemaOverrides);

        log.debug("Stage {}: {} tab(s) declared", ParseStage.EXTRACT_TABS, schemaMap.size());
        ExtractionOutcome extraction = tabExtractor.extract(workbook, schemaMap, registry, config, stats);
        results.addAll(extraction.getValidationResults());

        Map<String, String> schemas = new LinkedHashMap<>();
        schemaMap.forEach((tab, schema) -> schemas.put(tab, extraction.getSchemasUsed().containsKey(tab)
                ? schemaResolver.canonicalName(schema, registry) : schema));

        log.debug("Stage {}: {} of {} tab(s) extracted", ParseStage.ASSEMBLED,
                extraction.getTabContents().size(), schemaMap.size());
        return new ParseOutcome(ParseStage.ASSEMBLED,
                new ParsedWorkbook(metadata, schemas, extraction.getTabContents()), results);
    }
}
