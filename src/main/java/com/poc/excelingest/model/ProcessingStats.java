package com.poc.excelingest.model;

import com.poc.excelingest.util.MapProjection;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of one parse/validate pass. Owned by a single call; read-only once the pass ends.
 */
@Getter
public class ProcessingStats implements MapProjection.Projectable {

    public enum ErrorKind { VALIDATION, PROCESSING, WARNING }

    private Instant startTime;
    private Instant endTime;

    private int rowsProcessed;
    private int cellsProcessed;
    private int tabsProcessed;
    private int fieldsProcessed;

    private int validationErrors;
    private int processingErrors;
    private int warnings;

    public void startTiming() {
        startTime = Instant.now();
        endTime = null;
    }

    public void endTiming() {
        endTime = Instant.now();
    }

    public void incrementRows(int count) {
        rowsProcessed += count;
    }

    public void incrementCells(int count) {
        cellsProcessed += count;
    }

    public void incrementTabs(int count) {
        tabsProcessed += count;
    }

    public void incrementFields(int count) {
        fieldsProcessed += count;
    }

    public void recordError(ErrorKind kind) {
        switch (kind) {
            case VALIDATION:
                validationErrors++;
                break;
            case PROCESSING:
                processingErrors++;
                break;
            case WARNING:
                warnings++;
                break;
            default:
                throw new IllegalArgumentException("Unknown error kind " + kind);
        }
    }

    /**
     * Tallies non-passing results: errors count as validation errors, warnings as warnings.
     */
    public void recordResults(Iterable<ValidationResult> results) {
        for (ValidationResult result : results) {
            if (result.isValid()) {
                continue;
            }
            if (result.isError()) {
                recordError(ErrorKind.VALIDATION);
            } else if (result.isWarning()) {
                recordError(ErrorKind.WARNING);
            }
        }
    }

    public double getTotalTimeSeconds() {
        if (startTime == null || endTime == null || endTime.isBefore(startTime)) {
            return 0.0;
        }
        return Duration.between(startTime, endTime).toNanos() / 1_000_000_000.0;
    }

    public double getCellsPerSecond() {
        double total = getTotalTimeSeconds();
        return total > 0 ? cellsProcessed / total : 0.0;
    }

    public double getRowsPerSecond() {
        double total = getTotalTimeSeconds();
        return total > 0 ? rowsProcessed / total : 0.0;
    }

    public int getTotalErrors() {
        return validationErrors + processingErrors;
    }

    /**
     * Share of processed cells and fields that did not produce an error, from 0.0 to 1.0.
     */
    public double getSuccessRate() {
        int operations = cellsProcessed + fieldsProcessed;
        if (operations == 0) {
            return 1.0;
        }
        return Math.max(0.0, (operations - getTotalErrors()) / (double) operations);
    }

    public Map<String, Object> getSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_time_seconds", getTotalTimeSeconds());
        summary.put("rows_processed", rowsProcessed);
        summary.put("cells_processed", cellsProcessed);
        summary.put("tabs_processed", tabsProcessed);
        summary.put("fields_processed", fieldsProcessed);
        summary.put("validation_errors", validationErrors);
        summary.put("processing_errors", processingErrors);
        summary.put("warnings", warnings);
        summary.put("total_errors", getTotalErrors());
        summary.put("success_rate", getSuccessRate());
        summary.put("cells_per_second", getCellsPerSecond());
        summary.put("rows_per_second", getRowsPerSecond());
        return summary;
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("start_time", startTime == null ? null : startTime.toString());
        map.put("end_time", endTime == null ? null : endTime.toString());
        map.put("rows_processed", rowsProcessed);
        map.put("cells_processed", cellsProcessed);
        map.put("tabs_processed", tabsProcessed);
        map.put("fields_processed", fieldsProcessed);
        map.put("validation_errors", validationErrors);
        map.put("processing_errors", processingErrors);
        map.put("warnings", warnings);
        map.put("total_time", getTotalTimeSeconds());
        map.put("success_rate", getSuccessRate());
        return map;
    }
}
