package com.catmepim.converter.sheetjs.exception;

import java.util.List;

/**
 * Thrown when a requested sheet does not exist in the workbook.
 * Only the requested sheet is skipped; other sheets may still be compiled.
 */
public class SheetNotFoundException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final String sheetName;

    public SheetNotFoundException(String sheetName, List<String> availableSheets) {
        super("Sheet '" + sheetName + "' not found. Available sheets: " + availableSheets);
        this.sheetName = sheetName;
    }

    public String getSheetName() {
        return sheetName;
    }
}
