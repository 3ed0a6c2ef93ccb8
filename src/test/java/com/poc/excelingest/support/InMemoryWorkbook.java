package com.poc.excelingest.support;

import com.poc.excelingest.util.CellAddress;
import com.poc.excelingest.workbook.WorkbookHandle;
import com.poc.excelingest.workbook.WorksheetHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Workbook fixture held in memory, for cases a real file cannot express (illegal sheet names, tiny bounds).
 */
public class InMemoryWorkbook implements WorkbookHandle {

    private final Map<String, Sheet> sheets = new LinkedHashMap<>();
    private final Map<String, Object> properties = new LinkedHashMap<>();
    private boolean closed;

    public Sheet addSheet(String name) {
        return addSheet(name, 1_048_576, 16_384);
    }

    public Sheet addSheet(String name, int maxRows, int maxColumns) {
        Sheet sheet = new Sheet(name, maxRows, maxColumns);
        sheets.put(name, sheet);
        return sheet;
    }

    public InMemoryWorkbook property(String key, Object value) {
        properties.put(key, value);
        return this;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public List<String> sheetNames() {
        return new ArrayList<>(sheets.keySet());
    }

    @Override
    public Optional<WorksheetHandle> sheet(String name) {
        return Optional.ofNullable(sheets.get(name));
    }

    @Override
    public Map<String, Object> properties() {
        return new LinkedHashMap<>(properties);
    }

    @Override
    public void close() {
        closed = true;
    }

    public static class Sheet implements WorksheetHandle {

        private final String name;
        private final int maxRows;
        private final int maxColumns;
        private final Map<CellAddress, Object> cells = new LinkedHashMap<>();

        Sheet(String name, int maxRows, int maxColumns) {
            this.name = name;
            this.maxRows = maxRows;
            this.maxColumns = maxColumns;
        }

        public Sheet set(String address, Object value) {
            cells.put(CellAddress.parse(address), value);
            return this;
        }

        /**
         * Writes key/value pairs downwards from {@code startCell}, keys in its column and values one to the right.
         */
        public Sheet pairs(String startCell, Map<String, ?> pairs) {
            CellAddress key = CellAddress.parse(startCell);
            for (Map.Entry<String, ?> entry : pairs.entrySet()) {
                cells.put(key, entry.getKey());
                cells.put(key.offset(0, 1), entry.getValue());
                key = key.offset(1, 0);
            }
            return this;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Object getCell(CellAddress address) {
            return cells.get(address);
        }

        @Override
        public int maxRows() {
            return maxRows;
        }

        @Override
        public int maxColumns() {
            return maxColumns;
        }

        @Override
        public int firstRow() {
            return cells.keySet().stream().mapToInt(CellAddress::getRow).min().orElse(0);
        }

        @Override
        public int lastRow() {
            return cells.keySet().stream().mapToInt(CellAddress::getRow).max().orElse(0);
        }

        @Override
        public int firstColumn() {
            return cells.keySet().stream().mapToInt(CellAddress::getColumnIndex).min().orElse(0);
        }

        @Override
        public int lastColumn() {
            return cells.keySet().stream().mapToInt(CellAddress::getColumnIndex).max().orElse(0);
        }
    }
}
