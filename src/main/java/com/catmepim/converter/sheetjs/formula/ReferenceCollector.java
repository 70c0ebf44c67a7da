package com.catmepim.converter.sheetjs.formula;

import java.util.Set;
import java.util.TreeSet;

import com.catmepim.converter.sheetjs.formula.ast.BinaryOpNode;
import com.catmepim.converter.sheetjs.formula.ast.CellRefNode;
import com.catmepim.converter.sheetjs.formula.ast.FormulaNode;
import com.catmepim.converter.sheetjs.formula.ast.FormulaVisitor;
import com.catmepim.converter.sheetjs.formula.ast.LiteralNode;
import com.catmepim.converter.sheetjs.formula.ast.UnaryOpNode;
import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Collects the distinct cells a formula reads.
 */
public class ReferenceCollector {

    /**
     * @return every address appearing as a cell reference in {@code root}, in row-major order
     */
    public Set<CellAddress> collect(FormulaNode root) {
        Set<CellAddress> references = new TreeSet<>();
        root.accept(new Visitor(references));
        return references;
    }

    private static final class Visitor implements FormulaVisitor<Void> {

        private final Set<CellAddress> references;

        Visitor(Set<CellAddress> references) {
            this.references = references;
        }

        @Override
        public Void visitLiteral(LiteralNode node) {
            return null;
        }

        @Override
        public Void visitCellRef(CellRefNode node) {
            references.add(node.getAddress());
            return null;
        }

        @Override
        public Void visitBinaryOp(BinaryOpNode node) {
            node.getLeft().accept(this);
            node.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitUnaryOp(UnaryOpNode node) {
            node.getOperand().accept(this);
            return null;
        }
    }
}
