package com.poc.excelingest.workbook;

import com.poc.excelingest.util.CellAddress;

public interface WorksheetHandle {

    String name();

    /**
     * Last calculated value of the cell: String, Long, Double, Boolean, LocalDateTime, or null when empty.
     */
    Object getCell(CellAddress address);

    default Object getCell(String address) {
        return getCell(CellAddress.parse(address));
    }

    /** Largest row number this sheet format can hold. */
    int maxRows();

    /** Largest column number this sheet format can hold. */
    int maxColumns();

    /** First used row, 1-based; 0 for an empty sheet. */
    int firstRow();

    int lastRow();

    int firstColumn();

    int lastColumn();
}
