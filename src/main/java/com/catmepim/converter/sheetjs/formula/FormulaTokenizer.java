package com.catmepim.converter.sheetjs.formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.catmepim.converter.sheetjs.exception.UnsupportedFormulaException;
import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Splits a formula body into tokens. Anything that is not a number, string, boolean, single cell
 * reference, operator or parenthesis is rejected here with the offending substring.
 *
 * @invariant the produced token list always ends with exactly one {@code END} token
 */
final class FormulaTokenizer {

    private final String body;
    private final CellAddress cell;
    private int pos;

    /**
     * @param body formula text without the leading {@code =}
     * @param cell the formula's own cell; references resolve to its sheet
     */
    FormulaTokenizer(String body, CellAddress cell) {
        this.body = body;
        this.cell = cell;
    }

    List<FormulaToken> tokenize() {
        List<FormulaToken> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= body.length()) {
                tokens.add(new FormulaToken(FormulaToken.Type.END, "", pos));
                return tokens;
            }
            char c = body.charAt(pos);
            if (isDigit(c) || (c == '.' && pos + 1 < body.length() && isDigit(body.charAt(pos + 1)))) {
                tokens.add(readNumber());
            } else if (c == '"') {
                tokens.add(readString());
            } else if (isWordStart(c)) {
                tokens.add(readWord());
            } else if (c == '(') {
                tokens.add(new FormulaToken(FormulaToken.Type.LEFT_PAREN, "(", pos++));
            } else if (c == ')') {
                tokens.add(new FormulaToken(FormulaToken.Type.RIGHT_PAREN, ")", pos++));
            } else if (c == '<' || c == '>') {
                tokens.add(readComparison(c));
            } else if ("+-*/^&=".indexOf(c) >= 0) {
                tokens.add(new FormulaToken(FormulaToken.Type.OPERATOR, String.valueOf(c), pos++));
            } else {
                throw unsupportedCharacter(c);
            }
        }
    }

    private FormulaToken readNumber() {
        int start = pos;
        while (pos < body.length() && isDigit(body.charAt(pos))) {
            pos++;
        }
        if (pos < body.length() && body.charAt(pos) == '.') {
            pos++;
            while (pos < body.length() && isDigit(body.charAt(pos))) {
                pos++;
            }
        }
        if (pos < body.length() && (body.charAt(pos) == 'e' || body.charAt(pos) == 'E')) {
            int exponent = pos + 1;
            if (exponent < body.length() && (body.charAt(exponent) == '+' || body.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < body.length() && isDigit(body.charAt(exponent))) {
                pos = exponent;
                while (pos < body.length() && isDigit(body.charAt(pos))) {
                    pos++;
                }
            }
        }
        if (pos < body.length() && body.charAt(pos) == ':') {
            // whole-row range such as 1:3
            throw new UnsupportedFormulaException(cell, rangeFragment(start), "range reference");
        }
        if (pos < body.length() && isWordStart(body.charAt(pos))) {
            throw new UnsupportedFormulaException(cell, wordAt(start), "malformed number");
        }
        return new FormulaToken(FormulaToken.Type.NUMBER, body.substring(start, pos), start);
    }

    private FormulaToken readString() {
        int start = pos;
        StringBuilder content = new StringBuilder();
        pos++;
        while (pos < body.length()) {
            char c = body.charAt(pos);
            if (c == '"') {
                if (pos + 1 < body.length() && body.charAt(pos + 1) == '"') {
                    content.append('"');
                    pos += 2;
                    continue;
                }
                pos++;
                return new FormulaToken(FormulaToken.Type.STRING, content.toString(), start);
            }
            content.append(c);
            pos++;
        }
        throw new UnsupportedFormulaException(cell, body.substring(start), "unterminated string literal");
    }

    private FormulaToken readWord() {
        int start = pos;
        String word = wordAt(start);
        pos = start + word.length();

        if (pos < body.length() && body.charAt(pos) == '!') {
            throw new UnsupportedFormulaException(cell, word + "!" + wordAt(pos + 1), "cross-sheet reference");
        }
        if (pos < body.length() && body.charAt(pos) == ':') {
            throw new UnsupportedFormulaException(cell, rangeFragment(start), "range reference");
        }
        if (nextNonBlank(pos) == '(') {
            throw new UnsupportedFormulaException(cell, word + "(", "function call");
        }
        if (CellAddress.tryParse(cell.getSheet(), word).isPresent()) {
            return new FormulaToken(FormulaToken.Type.CELL_REF, word, start);
        }
        String upper = word.toUpperCase(Locale.ROOT);
        if (upper.equals("TRUE") || upper.equals("FALSE")) {
            return new FormulaToken(FormulaToken.Type.BOOLEAN, upper, start);
        }
        throw new UnsupportedFormulaException(cell, word, "named reference");
    }

    private FormulaToken readComparison(char first) {
        int start = pos++;
        if (pos < body.length()) {
            char second = body.charAt(pos);
            if (second == '=' || (first == '<' && second == '>')) {
                pos++;
                return new FormulaToken(FormulaToken.Type.OPERATOR, "" + first + second, start);
            }
        }
        return new FormulaToken(FormulaToken.Type.OPERATOR, String.valueOf(first), start);
    }

    private UnsupportedFormulaException unsupportedCharacter(char c) {
        switch (c) {
            case '\'':
                int close = body.indexOf('\'', pos + 1);
                int end = close < 0 ? body.length() : close + 1;
                String fragment = body.substring(pos, end);
                if (end < body.length() && body.charAt(end) == '!') {
                    fragment = fragment + "!" + wordAt(end + 1);
                }
                return new UnsupportedFormulaException(cell, fragment, "cross-sheet reference");
            case ':':
                return new UnsupportedFormulaException(cell, rangeFragment(pos), "range reference");
            case '%':
                return new UnsupportedFormulaException(cell, "%", "percent operator");
            case '{':
                int brace = body.indexOf('}', pos);
                return new UnsupportedFormulaException(cell,
                        body.substring(pos, brace < 0 ? body.length() : brace + 1), "array constant");
            case '#':
                return new UnsupportedFormulaException(cell, wordAt(pos + 1).isEmpty() ? "#" : "#" + wordAt(pos + 1),
                        "error literal");
            default:
                return new UnsupportedFormulaException(cell, String.valueOf(c), "unexpected character");
        }
    }

    /**
     * @return the reference-like run around a {@code :} starting at {@code start}, e.g. {@code A1:B2}
     */
    private String rangeFragment(int start) {
        int end = start;
        while (end < body.length() && (isWordPart(body.charAt(end)) || body.charAt(end) == ':')) {
            end++;
        }
        return body.substring(start, end);
    }

    private String wordAt(int start) {
        int end = start;
        while (end < body.length() && isWordPart(body.charAt(end))) {
            end++;
        }
        return body.substring(Math.min(start, body.length()), end);
    }

    private char nextNonBlank(int from) {
        int i = from;
        while (i < body.length() && Character.isWhitespace(body.charAt(i))) {
            i++;
        }
        return i < body.length() ? body.charAt(i) : '\0';
    }

    private void skipWhitespace() {
        while (pos < body.length() && Character.isWhitespace(body.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == '$' || c == '_' || c == '\\';
    }

    private static boolean isWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '$' || c == '_' || c == '.' || c == '\\';
    }
}
