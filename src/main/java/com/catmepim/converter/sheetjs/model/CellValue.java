package com.catmepim.converter.sheetjs.model;

import java.util.Objects;

/**
 * Literal content of a cell as an explicit tagged variant, so each consumer can pick the right
 * representation per kind instead of guessing from an untyped value.
 *
 * @invariant {@code kind == NUMBER} implies {@code number} is finite;
 *            {@code kind == STRING || kind == ERROR} implies {@code text != null}
 */
public final class CellValue {

    /** Variant tag. */
    public enum Kind {
        NUMBER, STRING, BOOLEAN, EMPTY, ERROR
    }

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, 0d, null, false);
    private static final CellValue TRUE = new CellValue(Kind.BOOLEAN, 0d, null, true);
    private static final CellValue FALSE = new CellValue(Kind.BOOLEAN, 0d, null, false);

    private final Kind kind;
    private final double number;
    private final String text;
    private final boolean bool;

    private CellValue(Kind kind, double number, String text, boolean bool) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.bool = bool;
    }

    public static CellValue ofNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cell numbers must be finite: " + value);
        }
        return new CellValue(Kind.NUMBER, value, null, false);
    }

    public static CellValue ofString(String value) {
        return new CellValue(Kind.STRING, 0d, Objects.requireNonNull(value, "value must not be null"), false);
    }

    public static CellValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * @param errorText spreadsheet error literal such as {@code #DIV/0!}
     */
    public static CellValue ofError(String errorText) {
        return new CellValue(Kind.ERROR, 0d, Objects.requireNonNull(errorText, "errorText must not be null"), false);
    }

    public static CellValue empty() {
        return EMPTY;
    }

    public Kind getKind() {
        return kind;
    }

    public double getNumber() {
        requireKind(Kind.NUMBER);
        return number;
    }

    /**
     * @return the string of a {@code STRING} value or the error literal of an {@code ERROR} value
     */
    public String getText() {
        if (kind != Kind.STRING && kind != Kind.ERROR) {
            throw new IllegalStateException("Cell value of kind " + kind + " has no text");
        }
        return text;
    }

    public boolean getBoolean() {
        requireKind(Kind.BOOLEAN);
        return bool;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected a " + expected + " cell value but was " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue that = (CellValue) o;
        return kind == that.kind
                && Double.compare(number, that.number) == 0
                && bool == that.bool
                && Objects.equals(text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, number, text, bool);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return Double.toString(number);
            case STRING:
                return "\"" + text + "\"";
            case BOOLEAN:
                return Boolean.toString(bool).toUpperCase();
            case ERROR:
                return text;
            default:
                return "<empty>";
        }
    }
}
