package com.catmepim.converter.sheetjs.formula.ast;

/**
 * Double-dispatch over the formula node kinds.
 *
 * @param <R> result of visiting a node
 */
public interface FormulaVisitor<R> {

    R visitLiteral(LiteralNode node);

    R visitCellRef(CellRefNode node);

    R visitBinaryOp(BinaryOpNode node);

    R visitUnaryOp(UnaryOpNode node);
}
