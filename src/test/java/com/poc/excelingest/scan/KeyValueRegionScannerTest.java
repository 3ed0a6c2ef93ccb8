package com.poc.excelingest.scan;

import com.poc.excelingest.exception.InvalidCellReferenceException;
import com.poc.excelingest.support.InMemoryWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyValueRegionScannerTest {

    private final KeyValueRegionScanner scanner = new KeyValueRegionScanner();
    private InMemoryWorkbook.Sheet sheet;

    @BeforeEach
    void setUp() {
        sheet = new InMemoryWorkbook().addSheet("_json_metadata");
    }

    @Test
    @DisplayName("reads pairs until the first empty key")
    void stopsAtFirstEmptyKey() {
        sheet.set("B15", "sector").set("C15", "Landfill")
                .set("B16", "schema_version").set("C16", "landfill_v01_00")
                .set("B17", "")
                .set("B18", "ignored").set("C18", "value");

        Map<String, Object> region = scanner.scan(sheet, "$B$15");

        assertThat(region).containsExactly(
                Map.entry("sector", "Landfill"),
                Map.entry("schema_version", "landfill_v01_00"));
    }

    @Test
    @DisplayName("a later duplicate key overwrites the earlier value")
    void lastWriteWins() {
        sheet.set("B15", "sector").set("C15", "Landfill")
                .set("B16", "sector").set("C16", "Oil and Gas");

        assertThat(scanner.scan(sheet, "B15")).containsExactly(Map.entry("sector", "Oil and Gas"));
    }

    @Test
    @DisplayName("empty values are kept and non-text keys are stringified")
    void keepsEmptyValues() {
        sheet.set("B15", "notes").set("B16", 42L).set("C16", "answer");

        Map<String, Object> region = scanner.scan(sheet, "B15");

        assertThat(region).containsEntry("notes", null).containsEntry("42", "answer");
    }

    @Test
    @DisplayName("an empty start cell gives an empty region")
    void emptyStart() {
        assertThat(scanner.scan(sheet, "B15")).isEmpty();
    }

    @Test
    @DisplayName("the row limit bounds the scan")
    void rowLimit() {
        sheet.set("B15", "a").set("B16", "b").set("B17", "c");

        assertThat(scanner.scan(sheet, "B15", 2)).containsOnlyKeys("a", "b");
    }

    @Test
    @DisplayName("the scan stops at the last row of the sheet")
    void sheetBoundary() {
        InMemoryWorkbook.Sheet small = new InMemoryWorkbook().addSheet("small", 16, 10);
        small.set("B15", "a").set("B16", "b");

        assertThat(scanner.scan(small, "B15")).containsOnlyKeys("a", "b");
    }

    @Test
    @DisplayName("an invalid start cell is rejected")
    void invalidStartCell() {
        assertThatThrownBy(() -> scanner.scan(sheet, "15B")).isInstanceOf(InvalidCellReferenceException.class);
    }
}
