package com.catmepim.converter.sheetjs.exception;

import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Thrown when a formula uses syntax outside the supported grammar: function calls, range
 * operators, cross-sheet references, named ranges or anything the tokenizer does not recognise.
 * <p>
 * Aborts compilation of the owning sheet.
 *
 * @invariant {@code getCell() != null && getFragment() != null}
 */
public class UnsupportedFormulaException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final CellAddress cell;
    private final String fragment;

    /**
     * @param cell the formula cell whose text could not be parsed
     * @param fragment the offending substring of the formula
     * @param reason short description of what is not supported
     */
    public UnsupportedFormulaException(CellAddress cell, String fragment, String reason) {
        super("Unsupported formula in cell " + cell.toQualifiedString() + ": " + reason + " '" + fragment + "'");
        this.cell = cell;
        this.fragment = fragment;
    }

    public CellAddress getCell() {
        return cell;
    }

    public String getFragment() {
        return fragment;
    }
}
