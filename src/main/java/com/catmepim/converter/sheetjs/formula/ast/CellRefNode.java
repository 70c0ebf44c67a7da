package com.catmepim.converter.sheetjs.formula.ast;

import java.util.Objects;

import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Read of a single cell.
 */
public final class CellRefNode implements FormulaNode {

    private final CellAddress address;

    public CellRefNode(CellAddress address) {
        this.address = Objects.requireNonNull(address, "address must not be null");
    }

    public CellAddress getAddress() {
        return address;
    }

    @Override
    public <R> R accept(FormulaVisitor<R> visitor) {
        return visitor.visitCellRef(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CellRefNode && address.equals(((CellRefNode) o).address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return address.toString();
    }
}
