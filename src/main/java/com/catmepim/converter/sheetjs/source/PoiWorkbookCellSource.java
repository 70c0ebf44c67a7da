package com.catmepim.converter.sheetjs.source;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.exception.FileUnreadableException;
import com.catmepim.converter.sheetjs.exception.SheetNotFoundException;
import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellRecord;
import com.catmepim.converter.sheetjs.model.CellValue;
import com.catmepim.converter.sheetjs.model.SheetCells;

/**
 * {@link CellSource} backed by an Apache POI workbook opened read-only.
 * <p>
 * Formula cells are reported with their formula text (prefixed with {@code =}) and the result the
 * spreadsheet application cached for them; every other cell is reported with its literal value.
 *
 * @invariant {@code workbook != null} until {@link #close()} is called
 */
public class PoiWorkbookCellSource implements CellSource {

    private static final Logger logger = LoggerFactory.getLogger(PoiWorkbookCellSource.class);

    private final Path file;
    private final Workbook workbook;

    private PoiWorkbookCellSource(Path file, Workbook workbook) {
        this.file = file;
        this.workbook = workbook;
    }

    /**
     * Opens a workbook file.
     *
     * @param file path to an {@code .xlsx} (or legacy {@code .xls}) workbook
     * @return an open cell source; the caller must close it
     * @throws FileUnreadableException if the file is missing or is not a readable workbook
     */
    public static PoiWorkbookCellSource open(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new FileUnreadableException(file, "file does not exist", null);
        }
        try {
            Workbook workbook = WorkbookFactory.create(file.toFile(), null, true);
            logger.info("Workbook opened: {} ({} sheets)", file, workbook.getNumberOfSheets());
            return new PoiWorkbookCellSource(file, workbook);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to open workbook {}: {}", file, e.getMessage());
            throw new FileUnreadableException(file, e.getMessage(), e);
        }
    }

    /**
     * Wraps an already open workbook, typically one built in memory.
     */
    public static PoiWorkbookCellSource wrap(Workbook workbook) {
        return new PoiWorkbookCellSource(null, workbook);
    }

    @Override
    public List<String> getSheetNames() {
        List<String> names = new ArrayList<>(workbook.getNumberOfSheets());
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            names.add(workbook.getSheetName(i));
        }
        return Collections.unmodifiableList(names);
    }

    @Override
    public SheetCells readSheet(String sheetName) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            // Sheet names are case-insensitive in spreadsheet applications
            for (String candidate : getSheetNames()) {
                if (candidate.equalsIgnoreCase(sheetName)) {
                    sheet = workbook.getSheet(candidate);
                    break;
                }
            }
        }
        if (sheet == null) {
            throw new SheetNotFoundException(sheetName, getSheetNames());
        }

        String name = sheet.getSheetName();
        List<CellRecord> records = new ArrayList<>();
        int formulas = 0;
        for (Row row : sheet) {
            for (Cell cell : row) {
                CellAddress address = new CellAddress(name, cell.getColumnIndex(), cell.getRowIndex());
                if (cell.getCellType() == CellType.FORMULA) {
                    records.add(CellRecord.formula(address, "=" + cell.getCellFormula(), readCachedResult(cell)));
                    formulas++;
                } else {
                    records.add(CellRecord.literal(address, readValue(cell, cell.getCellType())));
                }
            }
        }
        logger.debug("Read sheet '{}' from {}: {} cells, {} formulas", name,
                file == null ? "<in-memory>" : file, records.size(), formulas);
        return new SheetCells(name, records);
    }

    private CellValue readCachedResult(Cell cell) {
        return readValue(cell, cell.getCachedFormulaResultType());
    }

    private CellValue readValue(Cell cell, CellType type) {
        switch (type) {
            case NUMERIC:
                return CellValue.ofNumber(cell.getNumericCellValue());
            case STRING:
                return CellValue.ofString(cell.getStringCellValue());
            case BOOLEAN:
                return CellValue.ofBoolean(cell.getBooleanCellValue());
            case ERROR:
                return readError(cell);
            case BLANK:
            case _NONE:
            default:
                return CellValue.empty();
        }
    }

    /**
     * Error codes newer than POI's {@link FormulaError} table (e.g. {@code #SPILL!}) are kept as the
     * raw text stored in the file.
     */
    private CellValue readError(Cell cell) {
        try {
            return CellValue.ofError(FormulaError.forInt(cell.getErrorCellValue()).getString());
        } catch (IllegalArgumentException | IllegalStateException e) {
            String text = cell instanceof XSSFCell ? ((XSSFCell) cell).getErrorCellString() : null;
            if (text == null || text.isEmpty()) {
                text = FormulaError.NA.getString();
            }
            logger.warn("Unknown error value '{}' in cell {}: {}", text, cell.getAddress(), e.getMessage());
            return CellValue.ofError(text);
        }
    }

    @Override
    public void close() throws IOException {
        workbook.close();
        logger.debug("Workbook closed: {}", file == null ? "<in-memory>" : file);
    }
}
