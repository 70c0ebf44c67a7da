package com.catmepim.converter.sheetjs.exception;

import java.nio.file.Path;

/**
 * Thrown when the input file cannot be opened or parsed as a workbook.
 * Aborts the entire run.
 */
public class FileUnreadableException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final transient Path file;

    public FileUnreadableException(Path file, String reason, Throwable cause) {
        super("Cannot read workbook '" + file + "': " + reason, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
