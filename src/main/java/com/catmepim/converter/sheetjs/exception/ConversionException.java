package com.catmepim.converter.sheetjs.exception;

/**
 * Root of the error taxonomy of the sheet-to-JS converter.
 * <p>
 * Raised when a workbook, a sheet or a single formula cannot be compiled. Subclasses name the
 * offending sheet or cell so the failure is actionable; the converter never retries, since the
 * pipeline is deterministic and the same input reproduces the same error.
 */
public class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new ConversionException with the specified detail message.
     *
     * @param message the detail message
     */
    public ConversionException(String message) {
        super(message);
    }

    /**
     * Constructs a new ConversionException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
