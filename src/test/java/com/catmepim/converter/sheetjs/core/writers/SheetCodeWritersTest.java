package com.catmepim.converter.sheetjs.core.writers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.config.ConverterConfig;
import com.catmepim.converter.sheetjs.core.CompilationContext;
import com.catmepim.converter.sheetjs.core.SheetCompiler;
import com.catmepim.converter.sheetjs.support.InMemoryCellSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

class SheetCodeWritersTest {

    private static final InMemoryCellSource SOURCE = InMemoryCellSource.builder()
            .sheet("Sheet1").number("A1", 10).text("B1", "x").formula("B2", "=A1*2").formula("C3", "=B2+A1")
            .sheet("Empty").number("A1", 1)
            .build();

    private static CompiledSheet compile(String sheet, boolean includeTestCode) {
        return new SheetCompiler().compile(new CompilationContext(SOURCE, sheet, null, includeTestCode));
    }

    private static String writeAll(ISheetCodeWriter writer, ByteArrayOutputStream out, CompiledSheet... sheets)
            throws IOException {
        try (ISheetCodeWriter w = writer) {
            w.open();
            for (CompiledSheet sheet : sheets) {
                w.write(sheet);
            }
            w.flush();
            assertEquals(sheets.length, w.getSheetsWrittenCount());
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testJsSource() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CompiledSheet sheet1 = compile("Sheet1", true);
        CompiledSheet empty = compile("Empty", false);
        String js = writeAll(new JsSourceWriter(out), out, sheet1, empty);

        String expected = "// Code for sheet: Sheet1\n"
                + sheet1.getFunctionSource() + "\n"
                + "\n"
                + sheet1.getInvocationSource().orElseThrow() + "\n"
                + "\n"
                + "// Code for sheet: Empty\n"
                + empty.getFunctionSource() + "\n";
        assertEquals(expected, js);
    }

    @Test
    void testJsonManifest() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CompiledSheet sheet1 = compile("Sheet1", false);
        String json = writeAll(new JsonManifestWriter(out, true), out, sheet1, compile("Empty", true));

        JsonNode root = new ObjectMapper().readTree(json);
        assertTrue(root.isArray());
        assertEquals(2, root.size());

        JsonNode first = root.get(0);
        assertEquals("Sheet1", first.get("sheet").asText());
        assertEquals("Sheet1", first.get("functionName").asText());
        assertEquals("[\"B2\",\"C3\"]", first.get("computationOrder").toString());
        assertEquals(10, first.get("inputs").get("A1").asInt());
        assertTrue(first.get("inputs").get("A1").isIntegralNumber());
        assertEquals(sheet1.getFunctionSource(), first.get("functionSource").asText());
        assertEquals(sheet1.getInputObjectSource(), first.get("inputObjectSource").asText());
        assertFalse(first.has("invocationSource"));

        JsonNode second = root.get(1);
        assertEquals(0, second.get("inputs").size());
        assertTrue(second.get("invocationSource").asText().startsWith("const Empty_args = {};"));
    }

    @Test
    void testJsonManifestWithNoSheets() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertEquals("[]", writeAll(new JsonManifestWriter(out, false), out));
    }

    @Test
    void testCsvReport() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String csv = writeAll(new CsvReportWriter(out), out, compile("Sheet1", false), compile("Empty", false));

        List<CSVRecord> records;
        try (CSVParser parser = CSVParser.parse(new StringReader(csv), CSVFormat.DEFAULT)) {
            records = parser.getRecords();
        }
        assertEquals(3, records.size());
        assertEquals(List.of("sheet", "cell", "formula", "expression", "dependsOn"), records.get(0).toList());
        assertEquals(List.of("Sheet1", "B2", "=A1*2", "(d[\"A1\"] * 2)", "A1"), records.get(1).toList());
        assertEquals(List.of("Sheet1", "C3", "=B2+A1", "(computed[\"B2\"] + d[\"A1\"])", "A1 B2"),
                records.get(2).toList());
    }

    @Test
    void testWritingBeforeOpenFails() {
        JsSourceWriter writer = new JsSourceWriter(new ByteArrayOutputStream());
        assertThrows(IOException.class, () -> writer.write(compile("Sheet1", false)));
    }

    @Test
    void testFactoryPicksWriterForFormat() {
        ConverterConfig config = new ConverterConfig();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        assertInstanceOf(JsSourceWriter.class, SheetCodeWriterFactory.create(config, out));
        config.format = ConverterConfig.OutputFormat.JSON;
        assertInstanceOf(JsonManifestWriter.class, SheetCodeWriterFactory.create(config, out));
        config.format = ConverterConfig.OutputFormat.CSV;
        assertInstanceOf(CsvReportWriter.class, SheetCodeWriterFactory.create(config, out));
    }
}
