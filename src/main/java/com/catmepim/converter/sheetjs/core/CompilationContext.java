package com.catmepim.converter.sheetjs.core;

import java.util.Objects;
import java.util.Optional;

import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellRange;
import com.catmepim.converter.sheetjs.source.CellSource;

/**
 * Everything one sheet compilation needs, passed explicitly to every stage.
 * <p>
 * Holds no mutable state, so contexts for different sheets can be compiled independently.
 *
 * @invariant {@code source != null && sheetName != null}; not mutated after construction
 */
public final class CompilationContext {

    private final CellSource source;
    private final String sheetName;
    private final CellRange bound;
    private final boolean includeTestCode;

    /**
     * @param source workbook handle providing the sheet's cells
     * @param sheetName the sheet being compiled
     * @param bound region to compile, or {@code null} for the whole sheet
     * @param includeTestCode whether to produce the verification snippet
     */
    public CompilationContext(CellSource source, String sheetName, CellRange bound, boolean includeTestCode) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.sheetName = Objects.requireNonNull(sheetName, "sheetName must not be null");
        this.bound = bound;
        this.includeTestCode = includeTestCode;
    }

    public CellSource getSource() {
        return source;
    }

    public String getSheetName() {
        return sheetName;
    }

    public Optional<CellRange> getBound() {
        return Optional.ofNullable(bound);
    }

    public boolean isIncludeTestCode() {
        return includeTestCode;
    }

    /**
     * @return whether {@code address} is on the compiled sheet and inside the bound, if any
     */
    public boolean isInRegion(CellAddress address) {
        return address.getSheet().equals(sheetName) && (bound == null || bound.contains(address));
    }

    /**
     * @return a copy of this context for another sheet, e.g. after resolving the sheet name's case
     */
    public CompilationContext forSheet(String otherSheet) {
        return new CompilationContext(source, otherSheet, bound, includeTestCode);
    }

    @Override
    public String toString() {
        return "sheet '" + sheetName + "'" + (bound == null ? "" : " range " + bound);
    }
}
