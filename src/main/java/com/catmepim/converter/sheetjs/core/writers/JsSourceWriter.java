package com.catmepim.converter.sheetjs.core.writers;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;

/**
 * Writes compiled sheets as plain JavaScript: a comment naming the sheet, the function and, when
 * it was requested, the verification snippet.
 */
public class JsSourceWriter implements ISheetCodeWriter {

    private static final Logger logger = LoggerFactory.getLogger(JsSourceWriter.class);

    private final OutputStream target;
    private Writer writer;
    private long sheetsWritten = 0;

    /**
     * @param target stream receiving the source; not closed by this writer
     */
    public JsSourceWriter(OutputStream target) {
        this.target = target;
    }

    @Override
    public void open() throws IOException {
        if (writer != null) {
            logger.warn("JsSourceWriter is already open. Ignoring open() call.");
            return;
        }
        writer = new BufferedWriter(new OutputStreamWriter(target, StandardCharsets.UTF_8));
    }

    @Override
    public void write(CompiledSheet sheet) throws IOException {
        if (writer == null) throw new IOException("Writer is not open. Call open() first.");
        if (sheetsWritten > 0) {
            writer.write("\n");
        }
        writer.write("// Code for sheet: " + sheet.getSheetName() + "\n");
        writer.write(sheet.getFunctionSource());
        writer.write("\n");
        if (sheet.getInvocationSource().isPresent()) {
            writer.write("\n");
            writer.write(sheet.getInvocationSource().get());
            writer.write("\n");
        }
        sheetsWritten++;
        logger.debug("Wrote function {} for sheet '{}'", sheet.getFunctionName(), sheet.getSheetName());
    }

    @Override
    public void flush() throws IOException {
        if (writer == null) throw new IOException("Writer is not open. Call open() first.");
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        if (writer != null) {
            writer.flush();
            writer = null;
        }
        logger.debug("JsSourceWriter closed. Sheets written: {}", sheetsWritten);
    }

    @Override
    public long getSheetsWrittenCount() {
        return sheetsWritten;
    }
}
