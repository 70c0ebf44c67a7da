package com.catmepim.converter.sheetjs.model;

import java.util.Objects;

/**
 * One cell as delivered by a {@link com.catmepim.converter.sheetjs.source.CellSource}.
 * <p>
 * A formula record holds the raw formula text and the result the workbook cached for it; a
 * literal record holds only its value. Records are created once and never change.
 */
public final class CellRecord {

    private final CellAddress address;
    private final boolean formula;
    private final String rawFormula;
    private final CellValue value;

    private CellRecord(CellAddress address, boolean formula, String rawFormula, CellValue value) {
        this.address = Objects.requireNonNull(address, "address must not be null");
        this.formula = formula;
        this.rawFormula = rawFormula;
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public static CellRecord literal(CellAddress address, CellValue value) {
        return new CellRecord(address, false, null, value);
    }

    /**
     * @param rawFormula formula text, conventionally starting with {@code =}
     * @param cachedResult last result stored by the spreadsheet application, or {@link CellValue#empty()}
     */
    public static CellRecord formula(CellAddress address, String rawFormula, CellValue cachedResult) {
        return new CellRecord(address, true, Objects.requireNonNull(rawFormula, "rawFormula must not be null"),
                cachedResult);
    }

    public CellAddress getAddress() {
        return address;
    }

    public boolean isFormula() {
        return formula;
    }

    /**
     * @throws IllegalStateException for a literal record
     */
    public String getRawFormula() {
        if (!formula) {
            throw new IllegalStateException("Cell " + address + " holds a literal, not a formula");
        }
        return rawFormula;
    }

    /**
     * @return the literal value, or the cached result for a formula record
     */
    public CellValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        return address + (formula ? " " + rawFormula : " " + value);
    }
}
