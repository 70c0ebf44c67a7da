package com.catmepim.converter.sheetjs.model;

import java.util.Optional;

import com.catmepim.converter.sheetjs.exception.InvalidRangeException;

/**
 * Inclusive rectangular bound of the processed region, independent of any sheet.
 *
 * @invariant {@code min.column <= max.column && min.row <= max.row}
 */
public final class CellRange {

    static final String FIRST_CELL = "A1";
    static final String LAST_CELL = "XFD1048576";

    private static final String BOUND_SHEET = "";

    private final CellAddress min;
    private final CellAddress max;

    private CellRange(CellAddress min, CellAddress max) {
        this.min = min;
        this.max = max;
    }

    /**
     * Builds the bound from the textual min/max cells given on the command line.
     * A missing side defaults to the first or last cell of the grid.
     *
     * @return empty when neither side is configured (the whole sheet is processed)
     * @throws InvalidRangeException if a side is malformed or min lies after max in either axis
     */
    public static Optional<CellRange> fromBounds(String minCell, String maxCell) {
        boolean hasMin = minCell != null && !minCell.isBlank();
        boolean hasMax = maxCell != null && !maxCell.isBlank();
        if (!hasMin && !hasMax) {
            return Optional.empty();
        }
        CellAddress min = parseBound("minimum", hasMin ? minCell : FIRST_CELL);
        CellAddress max = parseBound("maximum", hasMax ? maxCell : LAST_CELL);
        if (min.getColumn() > max.getColumn() || min.getRow() > max.getRow()) {
            throw new InvalidRangeException("Invalid cell range: minimum " + min + " lies after maximum " + max);
        }
        return Optional.of(new CellRange(min, max));
    }

    private static CellAddress parseBound(String side, String text) {
        return CellAddress.tryParse(BOUND_SHEET, text)
                .orElseThrow(() -> new InvalidRangeException("Invalid " + side + " cell '" + text + "'"));
    }

    public CellAddress getMin() {
        return min;
    }

    public CellAddress getMax() {
        return max;
    }

    /**
     * @return whether the column and row of {@code address} fall inside the bound; the sheet is ignored
     */
    public boolean contains(CellAddress address) {
        return address.getColumn() >= min.getColumn() && address.getColumn() <= max.getColumn()
                && address.getRow() >= min.getRow() && address.getRow() <= max.getRow();
    }

    @Override
    public String toString() {
        return min + ":" + max;
    }
}
