package com.catmepim.converter.sheetjs.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.util.CellReference;

/**
 * Immutable coordinate of a single cell: sheet name, 0-based column and 0-based row.
 * <p>
 * The canonical string form is the sheet-relative {@code A1} notation; {@link #toQualifiedString()}
 * prefixes the sheet name. Ordering is row-major (row, then column, then sheet) which is the order
 * cells appear in a sheet and the tie-break order of the computation order.
 *
 * @invariant {@code 0 <= column <= 16383 && 0 <= row <= 1048575 && sheet != null}
 */
public final class CellAddress implements Comparable<CellAddress> {

    private static final Pattern A1_PATTERN = Pattern.compile("\\$?([A-Za-z]{1,3})\\$?([0-9]{1,7})");
    private static final SpreadsheetVersion VERSION = SpreadsheetVersion.EXCEL2007;

    private static final Comparator<CellAddress> ROW_MAJOR = Comparator
            .comparingInt(CellAddress::getRow)
            .thenComparingInt(CellAddress::getColumn)
            .thenComparing(CellAddress::getSheet);

    private final String sheet;
    private final int column;
    private final int row;

    /**
     * @param sheet owning sheet name
     * @param column 0-based column index
     * @param row 0-based row index
     * @throws IllegalArgumentException if the coordinate lies outside the spreadsheet grid
     */
    public CellAddress(String sheet, int column, int row) {
        this.sheet = Objects.requireNonNull(sheet, "sheet must not be null");
        if (column < 0 || column > VERSION.getLastColumnIndex()) {
            throw new IllegalArgumentException("Column index out of range: " + column);
        }
        if (row < 0 || row > VERSION.getLastRowIndex()) {
            throw new IllegalArgumentException("Row index out of range: " + row);
        }
        this.column = column;
        this.row = row;
    }

    /**
     * Parses an {@code A1}-style reference. Absolute markers ({@code $}) are accepted and discarded,
     * column letters are case-insensitive.
     *
     * @return the address, or empty if {@code text} is not a reference inside the spreadsheet grid
     */
    public static Optional<CellAddress> tryParse(String sheet, String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = A1_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int column = CellReference.convertColStringToIndex(matcher.group(1).toUpperCase());
        int row = Integer.parseInt(matcher.group(2)) - 1;
        if (column > VERSION.getLastColumnIndex() || row < 0 || row > VERSION.getLastRowIndex()) {
            return Optional.empty();
        }
        return Optional.of(new CellAddress(sheet, column, row));
    }

    /**
     * Same as {@link #tryParse(String, String)} but fails on malformed input.
     *
     * @throws IllegalArgumentException if {@code text} is not a valid cell reference
     */
    public static CellAddress parse(String sheet, String text) {
        return tryParse(sheet, text)
                .orElseThrow(() -> new IllegalArgumentException("Not a valid cell address: '" + text + "'"));
    }

    public String getSheet() {
        return sheet;
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public String getColumnLetters() {
        return CellReference.convertNumToColString(column);
    }

    /**
     * @return the same column and row on another sheet
     */
    public CellAddress onSheet(String otherSheet) {
        return new CellAddress(otherSheet, column, row);
    }

    public String toQualifiedString() {
        return sheet + "!" + this;
    }

    @Override
    public int compareTo(CellAddress other) {
        return ROW_MAJOR.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress that = (CellAddress) o;
        return column == that.column && row == that.row && sheet.equals(that.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, column, row);
    }

    /**
     * @return the canonical sheet-relative form, e.g. {@code B12}
     */
    @Override
    public String toString() {
        return getColumnLetters() + (row + 1);
    }
}
