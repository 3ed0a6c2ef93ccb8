package com.poc.excelingest.workbook;

import com.poc.excelingest.util.CellAddress;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

/**
 * Worksheet view over a POI {@link Sheet}. Formula cells report their cached result.
 */
class PoiWorksheetHandle implements WorksheetHandle {

    // Whole numbers beyond this are left as doubles
    private static final double MAX_EXACT_LONG = 9.007199254740992E15;

    private final Sheet sheet;
    private final SpreadsheetVersion version;

    PoiWorksheetHandle(Sheet sheet) {
        this.sheet = sheet;
        this.version = sheet.getWorkbook().getSpreadsheetVersion();
    }

    @Override
    public String name() {
        return sheet.getSheetName();
    }

    @Override
    public Object getCell(CellAddress address) {
        Row row = sheet.getRow(address.getRow() - 1);
        if (row == null) {
            return null;
        }
        return readValue(row.getCell(address.getColumnIndex() - 1));
    }

    @Override
    public int maxRows() {
        return version.getMaxRows();
    }

    @Override
    public int maxColumns() {
        return version.getMaxColumns();
    }

    @Override
    public int firstRow() {
        return sheet.getPhysicalNumberOfRows() == 0 ? 0 : sheet.getFirstRowNum() + 1;
    }

    @Override
    public int lastRow() {
        return sheet.getPhysicalNumberOfRows() == 0 ? 0 : sheet.getLastRowNum() + 1;
    }

    @Override
    public int firstColumn() {
        int first = Integer.MAX_VALUE;
        for (Row row : sheet) {
            if (row.getFirstCellNum() >= 0) {
                first = Math.min(first, row.getFirstCellNum() + 1);
            }
        }
        return first == Integer.MAX_VALUE ? 0 : first;
    }

    @Override
    public int lastColumn() {
        int last = 0;
        for (Row row : sheet) {
            // getLastCellNum is one past the last cell, which is the 1-based index
            last = Math.max(last, row.getLastCellNum());
        }
        return last;
    }

    static Object readValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue();
                }
                return number(cell.getNumericCellValue());
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                return FormulaError.forInt(cell.getErrorCellValue()).getString();
            case BLANK:
            default:
                return null;
        }
    }

    private static Object number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG) {
            return (long) value;
        }
        return value;
    }
}
