package com.catmepim.converter.sheetjs.formula;

/**
 * Lexical unit of a formula.
 */
final class FormulaToken {

    enum Type {
        NUMBER, STRING, BOOLEAN, CELL_REF, OPERATOR, LEFT_PAREN, RIGHT_PAREN, END
    }

    private final Type type;
    private final String text;
    private final int position;

    FormulaToken(Type type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    Type getType() {
        return type;
    }

    /**
     * @return the token's text; for string literals the unescaped content without quotes
     */
    String getText() {
        return text;
    }

    /**
     * @return offset of the token in the formula body (after the leading {@code =})
     */
    int getPosition() {
        return position;
    }

    boolean is(Type expected) {
        return type == expected;
    }

    boolean isOperator(String symbol) {
        return type == Type.OPERATOR && text.equals(symbol);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
