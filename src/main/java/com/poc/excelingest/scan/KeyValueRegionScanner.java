package com.poc.excelingest.scan;

import com.poc.excelingest.util.CellAddress;
import com.poc.excelingest.workbook.WorksheetHandle;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a vertical key/value region: key in the start column, value one column to the right,
 * one pair per row until the first empty key.
 */
@Slf4j
public class KeyValueRegionScanner {

    /**
     * Scans until an empty key. Later rows overwrite earlier rows with the same key; empty values are kept.
     *
     * @throws com.poc.excelingest.exception.InvalidCellReferenceException if {@code startCell} is not an address
     */
    public Map<String, Object> scan(WorksheetHandle sheet, String startCell) {
        return scan(sheet, startCell, Integer.MAX_VALUE);
    }

    /**
     * Same as {@link #scan(WorksheetHandle, String)} but reads at most {@code maxRows} rows.
     */
    public Map<String, Object> scan(WorksheetHandle sheet, String startCell, int maxRows) {
        CellAddress keyCell = CellAddress.parse(startCell);
        Map<String, Object> region = new LinkedHashMap<>();
        int lastRow = sheet.maxRows();

        for (int read = 0; read < maxRows && keyCell.getRow() <= lastRow; read++) {
            Object key = sheet.getCell(keyCell);
            if (isEmpty(key)) {
                return region;
            }
            Object value = sheet.getCell(keyCell.offset(0, 1));
            region.put(key.toString(), value);
            if (keyCell.getRow() == lastRow) {
                break;
            }
            keyCell = keyCell.offset(1, 0);
        }
        log.warn("Key/value scan of '{}' from {} stopped at the row limit without an empty key",
                sheet.name(), startCell);
        return region;
    }

    private static boolean isEmpty(Object key) {
        return key == null || (key instanceof String && ((String) key).isEmpty());
    }
}
