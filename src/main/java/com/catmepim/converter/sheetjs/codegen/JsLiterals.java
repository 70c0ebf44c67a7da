package com.catmepim.converter.sheetjs.codegen;

import com.catmepim.converter.sheetjs.model.CellValue;
import com.fasterxml.jackson.core.io.JsonStringEncoder;

/**
 * JavaScript literal syntax for cell values. JSON string escaping is valid JavaScript, so
 * strings are escaped with Jackson's encoder.
 */
public final class JsLiterals {

    private static final double MAX_PLAIN_INTEGER = 1e15;

    private JsLiterals() {
    }

    public static String of(CellValue value) {
        switch (value.getKind()) {
            case NUMBER:
                return number(value.getNumber());
            case STRING:
            case ERROR:
                return string(value.getText());
            case BOOLEAN:
                return value.getBoolean() ? "true" : "false";
            case EMPTY:
            default:
                return "null";
        }
    }

    /**
     * Integral values print without a fraction ({@code 10}, not {@code 10.0}).
     */
    public static String number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_PLAIN_INTEGER) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    public static String string(String text) {
        String escaped = new String(JsonStringEncoder.getInstance().quoteAsString(text));
        // line and paragraph separators are legal in JSON strings but not in older JS engines
        escaped = escaped.replace("\u2028", "\\u2028").replace("\u2029", "\\u2029");
        return "\"" + escaped + "\"";
    }
}
