package com.catmepim.converter.sheetjs.core.writers;

import java.io.OutputStream;

import com.catmepim.converter.sheetjs.config.ConverterConfig;

/**
 * Picks the {@link ISheetCodeWriter} matching the configured output format.
 */
public final class SheetCodeWriterFactory {

    private SheetCodeWriterFactory() {
    }

    /**
     * @param config validated configuration
     * @param target stream the writer writes to
     * @return an unopened writer
     */
    public static ISheetCodeWriter create(ConverterConfig config, OutputStream target) {
        switch (config.format) {
            case JS:
                return new JsSourceWriter(target);
            case JSON:
                return new JsonManifestWriter(target, config.prettyPrint);
            case CSV:
                return new CsvReportWriter(target);
            default:
                throw new IllegalArgumentException("Unsupported output format: " + config.format);
        }
    }
}
