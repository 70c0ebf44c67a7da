package com.catmepim.converter.sheetjs.exception;

/**
 * Thrown when the configured min/max cell bound is malformed or its minimum lies after its
 * maximum. Aborts the entire run.
 */
public class InvalidRangeException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public InvalidRangeException(String message) {
        super(message);
    }
}
