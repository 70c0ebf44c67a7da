package com.catmepim.converter.sheetjs.formula.ast;

import java.util.Objects;

import com.catmepim.converter.sheetjs.model.CellValue;

/**
 * Constant written directly in the formula: number, string or boolean.
 */
public final class LiteralNode implements FormulaNode {

    private final CellValue value;

    public LiteralNode(CellValue value) {
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public CellValue getValue() {
        return value;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralNode && value.equals(((LiteralNode) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
