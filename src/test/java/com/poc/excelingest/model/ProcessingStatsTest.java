package com.poc.excelingest.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProcessingStatsTest {

    @Test
    @DisplayName("an untouched pass has a perfect success rate and no time")
    void emptyStats() {
        ProcessingStats stats = new ProcessingStats();

        assertThat(stats.getSuccessRate()).isEqualTo(1.0);
        assertThat(stats.getTotalTimeSeconds()).isZero();
        assertThat(stats.getCellsPerSecond()).isZero();
    }

    @Test
    @DisplayName("only failed results are tallied, by severity")
    void recordsFailedResults() {
        ProcessingStats stats = new ProcessingStats();
        stats.recordResults(List.of(
                ValidationResult.error("a", "bad", "x"),
                ValidationResult.warning("b", "odd", "x", Map.of()),
                ValidationResult.passed("c", "ok", "x")));

        assertThat(stats.getValidationErrors()).isEqualTo(1);
        assertThat(stats.getWarnings()).isEqualTo(1);
        assertThat(stats.getTotalErrors()).isEqualTo(1);
    }

    @Test
    @DisplayName("success rate counts errors against cells and fields")
    void successRate() {
        ProcessingStats stats = new ProcessingStats();
        stats.incrementCells(3);
        stats.incrementFields(1);
        stats.recordError(ProcessingStats.ErrorKind.PROCESSING);

        assertThat(stats.getSuccessRate()).isEqualTo(0.75);
        assertThat(stats.getSummary()).containsEntry("processing_errors", 1).containsEntry("total_errors", 1);
    }

    @Test
    @DisplayName("rates divide the counters by the elapsed time")
    void rates() throws InterruptedException {
        ProcessingStats stats = new ProcessingStats();
        assertThat(stats.getRowsPerSecond()).isZero();

        stats.startTiming();
        stats.incrementRows(10);
        stats.incrementCells(40);
        Thread.sleep(20);
        stats.endTiming();

        double seconds = stats.getTotalTimeSeconds();
        assertThat(seconds).isPositive();
        assertThat(stats.getRowsPerSecond()).isCloseTo(10 / seconds, within(1e-6));
        assertThat(stats.getCellsPerSecond()).isCloseTo(40 / seconds, within(1e-6));
        assertThat(stats.getSummary()).containsEntry("rows_processed", 10).containsKey("rows_per_second");
    }

    @Test
    @DisplayName("timing produces a non-negative duration")
    void timing() {
        ProcessingStats stats = new ProcessingStats();
        stats.startTiming();
        stats.endTiming();

        assertThat(stats.getTotalTimeSeconds()).isGreaterThanOrEqualTo(0.0);
        assertThat(stats.toMap()).containsKeys("start_time", "end_time", "total_time");
    }
}
