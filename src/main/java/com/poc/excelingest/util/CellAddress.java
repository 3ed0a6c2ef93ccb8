package com.poc.excelingest.util;

import com.poc.excelingest.exception.InvalidCellReferenceException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellReference;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An Excel cell address such as {@code B15} or {@code $AB$15}, decomposed into
 * column letters and a 1-based row number.
 */
@Getter
@EqualsAndHashCode
public final class CellAddress {

    public enum Unit { ROW, COLUMN }

    private static final Pattern ADDRESS_PATTERN = Pattern.compile("^\\$?([A-Z]+)\\$?([0-9]+)$");
    private static final int MAX_COLUMN = SpreadsheetVersion.EXCEL2007.getMaxColumns();

    private final String column;
    private final int row;

    private CellAddress(String column, int row) {
        this.column = column;
        this.row = row;
    }

    /**
     * Resolves an address with or without {@code $} anchors.
     *
     * @throws InvalidCellReferenceException when the text is not column letters followed by digits,
     *                                       the row is below 1 or the column is beyond XFD
     */
    public static CellAddress parse(String address) {
        if (address == null || address.isEmpty()) {
            throw new InvalidCellReferenceException(address, "address is empty");
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(address);
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException(address, "expected column letters followed by a row number");
        }
        String column = matcher.group(1);
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidCellReferenceException(address, "row number out of range");
        }
        if (row < 1) {
            throw new InvalidCellReferenceException(address, "row must be 1 or greater");
        }
        if (column.length() > 3 || columnToIndex(column) > MAX_COLUMN) {
            throw new InvalidCellReferenceException(address, "column must be between A and XFD");
        }
        return new CellAddress(column, row);
    }

    public static CellAddress of(int columnIndex, int row) {
        if (columnIndex < 1 || columnIndex > MAX_COLUMN) {
            throw new InvalidCellReferenceException(columnIndex + ":" + row, "column must be between 1 and " + MAX_COLUMN);
        }
        if (row < 1) {
            throw new InvalidCellReferenceException(columnIndex + ":" + row, "row must be 1 or greater");
        }
        return new CellAddress(indexToColumn(columnIndex), row);
    }

    public static boolean isValid(String address) {
        try {
            parse(address);
            return true;
        } catch (InvalidCellReferenceException e) {
            return false;
        }
    }

    /**
     * Bijective base-26 rank of the column letters: A=1, Z=26, AA=27.
     */
    public static int columnToIndex(String column) {
        return CellReference.convertColStringToIndex(column) + 1;
    }

    public static String indexToColumn(int columnIndex) {
        return CellReference.convertNumToColString(columnIndex - 1);
    }

    /**
     * Sort key of an address: the row number for {@link Unit#ROW}, the column rank for {@link Unit#COLUMN}.
     */
    public static int sortKey(String address, Unit unit) {
        CellAddress resolved = parse(address);
        return unit == Unit.ROW ? resolved.getRow() : resolved.getColumnIndex();
    }

    public static Comparator<String> comparator(Unit unit) {
        return Comparator.comparingInt(address -> sortKey(address, unit));
    }

    public int getColumnIndex() {
        return columnToIndex(column);
    }

    /**
     * The address moved by the given number of rows and columns.
     */
    public CellAddress offset(int rows, int columns) {
        return of(getColumnIndex() + columns, row + rows);
    }

    public String toAbsolute() {
        return "$" + column + "$" + row;
    }

    @Override
    public String toString() {
        return column + row;
    }
}
