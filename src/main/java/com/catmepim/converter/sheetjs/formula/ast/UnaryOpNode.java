package com.catmepim.converter.sheetjs.formula.ast;

import java.util.Objects;

/**
 * Prefix sign applied to a sub-expression.
 */
public final class UnaryOpNode implements FormulaNode {

    private final UnaryOperator operator;
    private final FormulaNode operand;

    public UnaryOpNode(UnaryOperator operator, FormulaNode operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitUnaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryOpNode)) {
            return false;
        }
        UnaryOpNode that = (UnaryOpNode) o;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return "(" + operator.getSymbol() + operand + ")";
    }
}
