package com.catmepim.converter.sheetjs.codegen;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives JavaScript identifiers from sheet names.
 */
public final class JsNames {

    static final String DEFAULT_FUNCTION_NAME = "excelFunction";

    private static final Pattern INVALID_CHARACTERS = Pattern.compile("[^A-Za-z0-9_$]");

    private static final Set<String> RESERVED_WORDS = Set.of(
            "await", "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete",
            "do", "else", "enum", "export", "extends", "false", "finally", "for", "function", "if",
            "implements", "import", "in", "instanceof", "interface", "let", "new", "null", "package",
            "private", "protected", "public", "return", "static", "super", "switch", "this", "throw",
            "true", "try", "typeof", "var", "void", "while", "with", "yield", "arguments", "eval");

    private JsNames() {
    }

    /**
     * Strips every character outside {@code [A-Za-z0-9_$]}; guards against an empty result, a
     * leading digit and reserved words.
     *
     * @return a valid JavaScript function name
     */
    public static String functionName(String sheetName) {
        String sanitized = INVALID_CHARACTERS.matcher(sheetName == null ? "" : sheetName).replaceAll("");
        if (sanitized.isEmpty()) {
            return DEFAULT_FUNCTION_NAME;
        }
        if (Character.isDigit(sanitized.charAt(0)) || RESERVED_WORDS.contains(sanitized)) {
            return "_" + sanitized;
        }
        return sanitized;
    }

    /**
     * @param taken function names already declared in the same output
     * @return {@code name}, or {@code name_2}, {@code name_3}, ... whichever is free first
     */
    public static String uniqueName(String name, Set<String> taken) {
        if (!taken.contains(name)) {
            return name;
        }
        int suffix = 2;
        while (taken.contains(name + "_" + suffix)) {
            suffix++;
        }
        return name + "_" + suffix;
    }
}
