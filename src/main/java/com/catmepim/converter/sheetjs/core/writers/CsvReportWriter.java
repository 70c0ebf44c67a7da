package com.catmepim.converter.sheetjs.core.writers;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.codegen.ComputedCell;
import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Writes a computation report as CSV: one row per computed cell, in computation order, with the
 * source formula, the generated expression and the in-region cells it depends on
 * (space separated).
 *
 * @inv If open, csvPrinter is not null.
 */
public class CsvReportWriter implements ISheetCodeWriter {

    private static final Logger logger = LoggerFactory.getLogger(CsvReportWriter.class);

    static final String[] HEADER = {"sheet", "cell", "formula", "expression", "dependsOn"};

    private final OutputStream target;
    private CSVPrinter csvPrinter;
    private long sheetsWritten = 0;
    private long rowsWritten = 0;

    /**
     * @param target stream receiving the CSV; not closed by this writer
     */
    public CsvReportWriter(OutputStream target) {
        this.target = target;
    }

    @Override
    public void open() throws IOException {
        if (csvPrinter != null) {
            logger.warn("CsvReportWriter is already open. Ignoring open() call.");
            return;
        }
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(target, StandardCharsets.UTF_8));
        csvPrinter = new CSVPrinter(writer, CSVFormat.DEFAULT);
        csvPrinter.printRecord((Object[]) HEADER);
    }

    @Override
    public void write(CompiledSheet sheet) throws IOException {
        if (csvPrinter == null) throw new IOException("Writer is not open. Call open() first.");
        for (ComputedCell cell : sheet.getComputedCells()) {
            String dependsOn = cell.getDependencies().stream()
                    .sorted()
                    .map(CellAddress::toString)
                    .collect(Collectors.joining(" "));
            csvPrinter.printRecord(sheet.getSheetName(), cell.getAddress().toString(), cell.getFormula(),
                    cell.getExpression(), dependsOn);
            rowsWritten++;
        }
        sheetsWritten++;
    }

    @Override
    public void flush() throws IOException {
        if (csvPrinter == null) throw new IOException("Writer is not open. Call open() first.");
        csvPrinter.flush();
    }

    @Override
    public void close() throws IOException {
        if (csvPrinter != null) {
            try {
                csvPrinter.flush();
            } finally {
                csvPrinter = null;
            }
        }
        logger.debug("CsvReportWriter closed. Sheets written: {}, rows written: {}", sheetsWritten, rowsWritten);
    }

    @Override
    public long getSheetsWrittenCount() {
        return sheetsWritten;
    }
}
