package com.poc.excelingest.model;

import com.poc.excelingest.util.MapProjection;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything {@code processFile} produced for one file. Built once at the end of the call.
 */
@Value
public class ExcelParseResult implements MapProjection.Projectable {

    boolean success;
    Map<String, Object> metadata;
    Map<String, String> schemas;
    Map<String, Map<String, Object>> tabContents;
    List<ValidationResult> validationResults;
    ProcessingStats processingStats;
    List<String> errors;
    List<String> warnings;
    Path filePath;
    String fileChecksum;
    double processingTime;
    LocalDateTime timestamp;

    @Builder
    public ExcelParseResult(boolean success, ParsedWorkbook workbook, List<ValidationResult> validationResults,
                            ProcessingStats processingStats, List<String> fatalErrors, Path filePath,
                            String fileChecksum, double processingTime) {
        ParsedWorkbook content = workbook == null ? ParsedWorkbook.empty() : workbook;
        List<ValidationResult> results = validationResults == null ? List.of() : List.copyOf(validationResults);

        List<String> errorMessages = new ArrayList<>();
        if (fatalErrors != null) {
            errorMessages.addAll(fatalErrors);
        }
        results.stream()
                .filter(result -> !result.isValid() && result.isError())
                .map(ValidationResult::getMessage)
                .forEach(errorMessages::add);

        this.success = success;
        this.metadata = content.getMetadata();
        this.schemas = content.getSchemas();
        this.tabContents = content.getTabContents();
        this.validationResults = results;
        this.processingStats = processingStats == null ? new ProcessingStats() : processingStats;
        this.errors = Collections.unmodifiableList(errorMessages);
        this.warnings = results.stream()
                .filter(result -> !result.isValid() && result.isWarning())
                .map(ValidationResult::getMessage)
                .collect(Collectors.toUnmodifiableList());
        this.filePath = filePath;
        this.fileChecksum = fileChecksum;
        this.processingTime = processingTime;
        this.timestamp = LocalDateTime.now();
    }

    /**
     * Success with no error-severity result at all, regardless of strict mode.
     */
    public boolean isValid() {
        return success && errors.isEmpty();
    }

    public ParsedWorkbook toParsedWorkbook() {
        return new ParsedWorkbook(metadata, schemas, tabContents);
    }

    public String getErrorSummary() {
        if (errors.isEmpty()) {
            return "No errors";
        }
        return errors.size() + " error(s):\n" + errors.stream().map(error -> "  - " + error).collect(Collectors.joining("\n"));
    }

    public String getWarningSummary() {
        if (warnings.isEmpty()) {
            return "No warnings";
        }
        return warnings.size() + " warning(s):\n" + warnings.stream().map(warning -> "  - " + warning).collect(Collectors.joining("\n"));
    }

    public Map<String, Object> getValidationSummary() {
        long passed = validationResults.stream().filter(ValidationResult::isValid).count();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_validations", validationResults.size());
        summary.put("passed", passed);
        summary.put("failed", validationResults.size() - passed);
        summary.put("errors", validationResults.stream().filter(r -> !r.isValid() && r.isError()).count());
        summary.put("warnings", validationResults.stream().filter(r -> !r.isValid() && r.isWarning()).count());
        summary.put("success_rate", validationResults.isEmpty() ? 1.0 : passed / (double) validationResults.size());
        return summary;
    }

    public Map<String, Object> getFileInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        if (filePath == null) {
            return info;
        }
        String name = filePath.getFileName() == null ? "" : filePath.getFileName().toString();
        int dot = name.lastIndexOf('.');
        info.put("file_path", filePath.toString());
        info.put("file_name", name);
        info.put("file_extension", dot < 0 ? "" : name.substring(dot).toLowerCase());
        boolean exists = Files.isRegularFile(filePath);
        info.put("exists", exists);
        info.put("file_size_bytes", exists ? filePath.toFile().length() : null);
        info.put("sha256", fileChecksum);
        return info;
    }

    public Map<String, Object> getProcessingSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("success", success);
        summary.put("processing_time", processingTime);
        summary.put("tabs_extracted", tabContents.size());
        summary.put("error_count", errors.size());
        summary.put("warning_count", warnings.size());
        summary.put("stats", processingStats.getSummary());
        return summary;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("success", success);
        map.put("metadata", MapProjection.expandMap(metadata));
        map.put("schemas", MapProjection.expandMap(schemas));
        map.put("tab_contents", MapProjection.expandMap(tabContents));
        map.put("validation_results", MapProjection.expand(validationResults));
        map.put("processing_stats", processingStats.toMap());
        map.put("errors", new ArrayList<>(errors));
        map.put("warnings", new ArrayList<>(warnings));
        map.put("file_path", filePath == null ? null : filePath.toString());
        map.put("file_checksum", fileChecksum);
        map.put("processing_time", processingTime);
        map.put("timestamp", timestamp.toString());
        return map;
    }
}
