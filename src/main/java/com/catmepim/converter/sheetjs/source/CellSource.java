package com.catmepim.converter.sheetjs.source;

import java.io.Closeable;
import java.util.List;

import com.catmepim.converter.sheetjs.exception.SheetNotFoundException;
import com.catmepim.converter.sheetjs.model.SheetCells;

/**
 * Opaque provider of cell records, one sheet at a time.
 * <p>
 * Reading is synchronous: {@link #readSheet(String)} returns fully materialised records before
 * any compilation stage starts. Implementations own the underlying workbook handle and release it
 * in {@link #close()}.
 */
public interface CellSource extends Closeable {

    /**
     * @return sheet names in workbook order
     */
    List<String> getSheetNames();

    /**
     * Reads every non-empty cell of a sheet, formulas and literals alike, regardless of any
     * bound; the compiler decides which of them belong to the processed region.
     *
     * @param sheetName the sheet to read
     * @return the sheet's cell records in row-major order
     * @throws SheetNotFoundException if the workbook has no such sheet
     * @pre {@code sheetName != null}
     */
    SheetCells readSheet(String sheetName);
}
