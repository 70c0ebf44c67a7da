package com.catmepim.converter.sheetjs.formula.ast;

/**
 * Node of a parsed formula. Trees are immutable once built; parentheses only shape the tree and
 * never appear as nodes.
 */
public interface FormulaNode {

    <R> R accept(FormulaVisitor<R> visitor);
}
