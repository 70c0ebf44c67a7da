package com.catmepim.converter.sheetjs.formula.ast;

import java.util.Objects;

/**
 * Infix operation on two sub-expressions.
 */
public final class BinaryOpNode implements FormulaNode {

    private final BinaryOperator operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryOpNode(BinaryOperator operator, FormulaNode left, FormulaNode right) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public FormulaNode getLeft() {
        return left;
    }

    public FormulaNode getRight() {
        return right;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitBinaryOp(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryOpNode)) {
            return false;
        }
        BinaryOpNode that = (BinaryOpNode) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
