package com.catmepim.converter.sheetjs.codegen;

import java.util.Locale;
import java.util.Set;

import com.catmepim.converter.sheetjs.formula.ast.BinaryOpNode;
import com.catmepim.converter.sheetjs.formula.ast.BinaryOperator;
import com.catmepim.converter.sheetjs.formula.ast.CellRefNode;
import com.catmepim.converter.sheetjs.formula.ast.FormulaNode;
import com.catmepim.converter.sheetjs.formula.ast.FormulaVisitor;
import com.catmepim.converter.sheetjs.formula.ast.LiteralNode;
import com.catmepim.converter.sheetjs.formula.ast.UnaryOpNode;
import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellValue;

/**
 * Rewrites a formula tree as a JavaScript expression.
 * <p>
 * Cell reads resolve to the computed-value container when the cell is a formula of the region and
 * to the input container otherwise. Every operation is parenthesised, so the spreadsheet's
 * evaluation order holds whatever JavaScript's own precedence rules are.
 * <p>
 * Text concatenation and comparisons follow spreadsheet rules rather than JavaScript's:
 * <ul>
 * <li>{@code &} renders a blank cell as {@code ""} and booleans as {@code TRUE}/{@code FALSE};</li>
 * <li>a blank cell compares as {@code 0}, {@code ""} or {@code FALSE} depending on the other operand;</li>
 * <li>text compares case-insensitively.</li>
 * </ul>
 * The coercions are inlined only where an operand's type is not known at compile time, which is
 * the case for cell reads alone.
 */
public class JsExpressionTranslator implements FormulaVisitor<String> {

    public static final String INPUT_CONTAINER = "d";
    public static final String COMPUTED_CONTAINER = "computed";

    /**
     * Type of an operand as far as it can be told from the formula alone.
     */
    enum OperandKind {
        NUMBER, TEXT, BOOLEAN, UNKNOWN
    }

    private final Set<CellAddress> computedCells;

    /**
     * @param computedCells formula cells of the region; every other cell is read from the inputs
     */
    public JsExpressionTranslator(Set<CellAddress> computedCells) {
        this.computedCells = computedCells;
    }

    public String translate(FormulaNode root) {
        return root.accept(this);
    }

    /**
     * @return the read of {@code address} from the container it lives in, e.g. {@code d["A1"]}
     */
    public String read(CellAddress address) {
        String container = computedCells.contains(address) ? COMPUTED_CONTAINER : INPUT_CONTAINER;
        return container + "[" + JsLiterals.string(address.toString()) + "]";
    }

    @Override
    public String visitLiteral(LiteralNode node) {
        return JsLiterals.of(node.getValue());
    }

    @Override
    public String visitCellRef(CellRefNode node) {
        return read(node.getAddress());
    }

    @Override
    public String visitBinaryOp(BinaryOpNode node) {
        switch (node.getOperator()) {
            case CONCAT:
                return "(\"\" + " + asText(node.getLeft()) + " + " + asText(node.getRight()) + ")";
            case POWER:
                return "(" + node.getLeft().accept(this) + " ** " + node.getRight().accept(this) + ")";
            case EQUAL:
                return comparison(node, "===");
            case NOT_EQUAL:
                return comparison(node, "!==");
            case LESS:
            case LESS_OR_EQUAL:
            case GREATER:
            case GREATER_OR_EQUAL:
                return comparison(node, node.getOperator().getSymbol());
            default:
                return "(" + node.getLeft().accept(this) + " " + node.getOperator().getSymbol() + " "
                        + node.getRight().accept(this) + ")";
        }
    }

    @Override
    public String visitUnaryOp(UnaryOpNode node) {
        return "(" + node.getOperator().getSymbol() + node.getOperand().accept(this) + ")";
    }

    static OperandKind kindOf(FormulaNode node) {
        if (node instanceof LiteralNode) {
            switch (((LiteralNode) node).getValue().getKind()) {
                case NUMBER:
                    return OperandKind.NUMBER;
                case STRING:
                case ERROR:
                    return OperandKind.TEXT;
                case BOOLEAN:
                    return OperandKind.BOOLEAN;
                default:
                    return OperandKind.UNKNOWN;
            }
        }
        if (node instanceof BinaryOpNode) {
            BinaryOpNode binary = (BinaryOpNode) node;
            if (binary.getOperator().isComparison()) {
                return OperandKind.BOOLEAN;
            }
            return binary.getOperator() == BinaryOperator.CONCAT
                    ? OperandKind.TEXT
                    : OperandKind.NUMBER;
        }
        if (node instanceof UnaryOpNode) {
            return OperandKind.NUMBER;
        }
        return OperandKind.UNKNOWN;
    }

    /**
     * Operand of {@code &} as it would be displayed: blank as empty text, booleans upper case.
     */
    private String asText(FormulaNode operand) {
        String js = operand.accept(this);
        switch (kindOf(operand)) {
            case NUMBER:
            case TEXT:
                return js;
            case BOOLEAN:
                if (operand instanceof LiteralNode) {
                    return ((LiteralNode) operand).getValue().getBoolean() ? "\"TRUE\"" : "\"FALSE\"";
                }
                return "(" + js + " ? \"TRUE\" : \"FALSE\")";
            default:
                return "(" + js + " === null ? \"\" : " + js + " === true ? \"TRUE\" : "
                        + js + " === false ? \"FALSE\" : " + js + ")";
        }
    }

    private String comparison(BinaryOpNode node, String jsOperator) {
        String left = comparable(node.getLeft(), node.getRight());
        String right = comparable(node.getRight(), node.getLeft());
        return "(" + left + " " + jsOperator + " " + right + ")";
    }

    /**
     * Operand of a comparison: text folded to upper case, a blank cell replaced by the blank value
     * of the other operand's type.
     */
    private String comparable(FormulaNode operand, FormulaNode other) {
        switch (kindOf(operand)) {
            case NUMBER:
            case BOOLEAN:
                return operand.accept(this);
            case TEXT:
                if (operand instanceof LiteralNode) {
                    CellValue value = ((LiteralNode) operand).getValue();
                    return JsLiterals.string(value.getText().toUpperCase(Locale.ROOT));
                }
                return operand.accept(this) + ".toUpperCase()";
            default:
                String js = operand.accept(this);
                return "(" + js + " === null ? " + blankAs(other) + " : typeof " + js + " === \"string\" ? "
                        + js + ".toUpperCase() : " + js + ")";
        }
    }

    private String blankAs(FormulaNode other) {
        switch (kindOf(other)) {
            case NUMBER:
                return "0";
            case TEXT:
                return "\"\"";
            case BOOLEAN:
                return "false";
            default:
                String js = other.accept(this);
                return "(typeof " + js + " === \"string\" ? \"\" : typeof " + js + " === \"boolean\" ? false : 0)";
        }
    }
}
