package com.catmepim.converter.sheetjs.codegen;

import java.util.Set;

import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * One assignment of the generated function: a formula cell, its source formula, its translated
 * expression and the in-region cells it depends on.
 */
public final class ComputedCell {

    private final CellAddress address;
    private final String formula;
    private final String expression;
    private final Set<CellAddress> dependencies;

    public ComputedCell(CellAddress address, String formula, String expression, Set<CellAddress> dependencies) {
        this.address = address;
        this.formula = formula;
        this.expression = expression;
        this.dependencies = Set.copyOf(dependencies);
    }

    public CellAddress getAddress() {
        return address;
    }

    public String getFormula() {
        return formula;
    }

    public String getExpression() {
        return expression;
    }

    public Set<CellAddress> getDependencies() {
        return dependencies;
    }

    @Override
    public String toString() {
        return address + " = " + expression;
    }
}
