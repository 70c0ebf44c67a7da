package com.catmepim.converter.sheetjs.core.writers;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.codegen.ComputedCell;
import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellValue;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

/**
 * Writes compiled sheets as a single JSON array using the Jackson streaming API, one object per
 * sheet:
 * <pre>
 * {"sheet": "...", "functionName": "...", "computationOrder": ["B2", ...],
 *  "inputs": {"A1": 10, ...}, "functionSource": "...", "inputObjectSource": "...",
 *  "invocationSource": "..."}
 * </pre>
 * Input values keep their type (number, string, boolean, null).
 *
 * @inv If open, jsonGenerator is not null.
 * @inv The output is a single, well-formed JSON array once the writer is closed.
 */
public class JsonManifestWriter implements ISheetCodeWriter {

    private static final Logger logger = LoggerFactory.getLogger(JsonManifestWriter.class);

    private final OutputStream target;
    private final boolean prettyPrint;
    private JsonGenerator jsonGenerator;
    private long sheetsWritten = 0;

    /**
     * @param target stream receiving the JSON; not closed by this writer
     * @param prettyPrint whether to indent the output
     */
    public JsonManifestWriter(OutputStream target, boolean prettyPrint) {
        this.target = target;
        this.prettyPrint = prettyPrint;
    }

    @Override
    public void open() throws IOException {
        if (jsonGenerator != null) {
            logger.warn("JsonManifestWriter is already open. Ignoring open() call.");
            return;
        }
        JsonFactory factory = new JsonFactory();
        jsonGenerator = factory.createGenerator(target, JsonEncoding.UTF8);
        jsonGenerator.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        if (prettyPrint) {
            jsonGenerator.useDefaultPrettyPrinter();
        }
        jsonGenerator.writeStartArray();
    }

    @Override
    public void write(CompiledSheet sheet) throws IOException {
        if (jsonGenerator == null) throw new IOException("Writer is not open. Call open() first.");

        jsonGenerator.writeStartObject();
        jsonGenerator.writeStringField("sheet", sheet.getSheetName());
        jsonGenerator.writeStringField("functionName", sheet.getFunctionName());

        jsonGenerator.writeArrayFieldStart("computationOrder");
        for (ComputedCell cell : sheet.getComputedCells()) {
            jsonGenerator.writeString(cell.getAddress().toString());
        }
        jsonGenerator.writeEndArray();

        jsonGenerator.writeObjectFieldStart("inputs");
        for (Map.Entry<CellAddress, CellValue> input : sheet.getInputs().entrySet()) {
            jsonGenerator.writeFieldName(input.getKey().toString());
            writeValue(input.getValue());
        }
        jsonGenerator.writeEndObject();

        jsonGenerator.writeStringField("functionSource", sheet.getFunctionSource());
        jsonGenerator.writeStringField("inputObjectSource", sheet.getInputObjectSource());
        if (sheet.getInvocationSource().isPresent()) {
            jsonGenerator.writeStringField("invocationSource", sheet.getInvocationSource().get());
        }
        jsonGenerator.writeEndObject();
        sheetsWritten++;
        logger.debug("Wrote JSON manifest entry for sheet '{}'", sheet.getSheetName());
    }

    private void writeValue(CellValue value) throws IOException {
        switch (value.getKind()) {
            case NUMBER:
                double number = value.getNumber();
                if (number == Math.rint(number) && Math.abs(number) < 1e15) {
                    jsonGenerator.writeNumber((long) number);
                } else {
                    jsonGenerator.writeNumber(number);
                }
                break;
            case STRING:
            case ERROR:
                jsonGenerator.writeString(value.getText());
                break;
            case BOOLEAN:
                jsonGenerator.writeBoolean(value.getBoolean());
                break;
            default:
                jsonGenerator.writeNull();
                break;
        }
    }

    @Override
    public void flush() throws IOException {
        if (jsonGenerator == null) throw new IOException("Writer is not open. Call open() first.");
        jsonGenerator.flush();
    }

    @Override
    public void close() throws IOException {
        if (jsonGenerator != null) {
            try {
                if (!jsonGenerator.isClosed()) {
                    jsonGenerator.writeEndArray();
                    jsonGenerator.flush();
                    jsonGenerator.close();
                }
            } catch (IOException e) {
                logger.error("Error closing JsonGenerator: {}", e.getMessage(), e);
                throw e;
            } finally {
                jsonGenerator = null;
            }
        }
        logger.debug("JsonManifestWriter closed. Sheets written: {}", sheetsWritten);
    }

    @Override
    public long getSheetsWrittenCount() {
        return sheetsWritten;
    }
}
