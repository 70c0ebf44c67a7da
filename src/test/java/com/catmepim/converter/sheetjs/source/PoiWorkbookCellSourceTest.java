package com.catmepim.converter.sheetjs.source;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFFormulaEvaluator;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.STCellType;

import com.catmepim.converter.sheetjs.exception.FileUnreadableException;
import com.catmepim.converter.sheetjs.exception.SheetNotFoundException;
import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellRecord;
import com.catmepim.converter.sheetjs.model.CellValue;
import com.catmepim.converter.sheetjs.model.SheetCells;

import static org.junit.jupiter.api.Assertions.*;

class PoiWorkbookCellSourceTest {

    @TempDir
    Path tempDir;

    private static XSSFWorkbook sampleWorkbook() {
        XSSFWorkbook workbook = new XSSFWorkbook();
        Sheet inputs = workbook.createSheet("Inputs");
        Row first = inputs.createRow(0);
        first.createCell(0).setCellValue(10);
        first.createCell(1).setCellValue("label");
        first.createCell(2).setCellValue(true);
        Row second = inputs.createRow(1);
        second.createCell(1).setCellFormula("A1*2");
        second.createCell(2).setCellFormula("1/0");
        second.createCell(3).setCellFormula("B1&\"!\"");
        workbook.createSheet("Other Sheet").createRow(4).createCell(3).setCellValue(1.5);
        XSSFFormulaEvaluator.evaluateAllFormulaCells(workbook);
        return workbook;
    }

    private static CellAddress at(String sheet, String a1) {
        return CellAddress.parse(sheet, a1);
    }

    @Test
    void testReadsLiteralsAndFormulas() throws Exception {
        try (PoiWorkbookCellSource source = PoiWorkbookCellSource.wrap(sampleWorkbook())) {
            assertEquals(List.of("Inputs", "Other Sheet"), source.getSheetNames());

            SheetCells cells = source.readSheet("Inputs");
            assertEquals(6, cells.size());
            assertEquals(CellValue.ofNumber(10), cells.valueAt(at("Inputs", "A1")));
            assertEquals(CellValue.ofString("label"), cells.valueAt(at("Inputs", "B1")));
            assertEquals(CellValue.ofBoolean(true), cells.valueAt(at("Inputs", "C1")));

            CellRecord doubled = cells.find(at("Inputs", "B2")).orElseThrow();
            assertTrue(doubled.isFormula());
            assertEquals("=A1*2", doubled.getRawFormula());
            assertEquals(CellValue.ofNumber(20), doubled.getValue());

            assertEquals(CellValue.ofError(FormulaError.DIV0.getString()), cells.valueAt(at("Inputs", "C2")));
            assertEquals(CellValue.ofString("label!"), cells.valueAt(at("Inputs", "D2")));
            assertEquals(CellValue.empty(), cells.valueAt(at("Inputs", "Z99")));
        }
    }

    @Test
    void testErrorCodesUnknownToPoiAreKeptAsText() throws Exception {
        XSSFWorkbook workbook = new XSSFWorkbook();
        XSSFSheet sheet = workbook.createSheet("Dynamic");
        XSSFRow row = sheet.createRow(0);
        row.createCell(0).setCellValue(3);
        XSSFCell spill = row.createCell(1);
        spill.setCellValue(0);
        spill.getCTCell().setT(STCellType.E);
        spill.getCTCell().setV("#SPILL!");
        XSSFCell calc = row.createCell(2);
        calc.setCellFormula("A1*2");
        calc.getCTCell().setT(STCellType.E);
        calc.getCTCell().setV("#CALC!");

        try (PoiWorkbookCellSource source = PoiWorkbookCellSource.wrap(workbook)) {
            SheetCells cells = source.readSheet("Dynamic");
            assertEquals(CellValue.ofError("#SPILL!"), cells.valueAt(at("Dynamic", "B1")));
            CellRecord formula = cells.find(at("Dynamic", "C1")).orElseThrow();
            assertEquals("=A1*2", formula.getRawFormula());
            assertEquals(CellValue.ofError("#CALC!"), formula.getValue());
            assertEquals(CellValue.ofNumber(3), cells.valueAt(at("Dynamic", "A1")));
        }
    }

    @Test
    void testSheetNameFallsBackToCaseInsensitiveMatch() throws Exception {
        try (PoiWorkbookCellSource source = PoiWorkbookCellSource.wrap(sampleWorkbook())) {
            SheetCells cells = source.readSheet("other sheet");
            assertEquals("Other Sheet", cells.getSheetName());
            assertEquals(CellValue.ofNumber(1.5), cells.valueAt(at("Other Sheet", "D5")));
        }
    }

    @Test
    void testMissingSheet() throws Exception {
        try (PoiWorkbookCellSource source = PoiWorkbookCellSource.wrap(sampleWorkbook())) {
            SheetNotFoundException ex = assertThrows(SheetNotFoundException.class, () -> source.readSheet("Summary"));
            assertEquals("Summary", ex.getSheetName());
            assertTrue(ex.getMessage().contains("Inputs"));
        }
    }

    @Test
    void testOpensWorkbookFile() throws Exception {
        Path file = tempDir.resolve("book.xlsx");
        try (XSSFWorkbook workbook = sampleWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            workbook.write(out);
        }
        try (PoiWorkbookCellSource source = PoiWorkbookCellSource.open(file)) {
            assertEquals("=A1*2", source.readSheet("Inputs").find(at("Inputs", "B2")).orElseThrow().getRawFormula());
        }
    }

    @Test
    void testMissingFileIsUnreadable() {
        Path missing = tempDir.resolve("missing.xlsx");
        FileUnreadableException ex = assertThrows(FileUnreadableException.class,
                () -> PoiWorkbookCellSource.open(missing));
        assertEquals(missing, ex.getFile());
    }

    @Test
    void testCorruptFileIsUnreadable() throws Exception {
        Path corrupt = tempDir.resolve("corrupt.xlsx");
        Files.writeString(corrupt, "this is not a workbook");
        assertThrows(FileUnreadableException.class, () -> PoiWorkbookCellSource.open(corrupt));
    }
}
