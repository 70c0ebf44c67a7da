package com.catmepim.converter.sheetjs.formula;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.exception.UnsupportedFormulaException;
import com.catmepim.converter.sheetjs.formula.ast.BinaryOpNode;
import com.catmepim.converter.sheetjs.formula.ast.BinaryOperator;
import com.catmepim.converter.sheetjs.formula.ast.CellRefNode;
import com.catmepim.converter.sheetjs.formula.ast.FormulaNode;
import com.catmepim.converter.sheetjs.formula.ast.LiteralNode;
import com.catmepim.converter.sheetjs.formula.ast.UnaryOpNode;
import com.catmepim.converter.sheetjs.formula.ast.UnaryOperator;
import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellValue;

/**
 * Recursive-descent parser turning formula text into a {@link FormulaNode} tree.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 * comparison := concat (('=' | '&lt;&gt;' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') concat)*
 * concat     := expr ('&amp;' expr)*
 * expr       := term (('+' | '-') term)*
 * term       := power (('*' | '/') power)*
 * power      := unary ('^' unary)*
 * unary      := ('-' | '+') unary | factor
 * factor     := number | string | TRUE | FALSE | cellRef | '(' comparison ')'
 * </pre>
 * All binary operators are left-associative. The parser is stateless and thread-safe; each call
 * works on its own token cursor.
 */
public class FormulaParser {

    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    /**
     * Parses a formula.
     *
     * @param rawFormula formula text, with or without the leading {@code =}
     * @param cell the cell owning the formula; references resolve to its sheet and errors name it
     * @return the root of the formula tree
     * @throws UnsupportedFormulaException if the formula uses syntax outside the grammar
     * @pre {@code rawFormula != null && cell != null}
     */
    public FormulaNode parse(String rawFormula, CellAddress cell) {
        String body = rawFormula.strip();
        if (body.startsWith("=")) {
            body = body.substring(1);
        }
        if (body.isBlank()) {
            throw new UnsupportedFormulaException(cell, rawFormula, "empty formula");
        }
        List<FormulaToken> tokens = new FormulaTokenizer(body, cell).tokenize();
        FormulaNode root = new Cursor(body, tokens, cell).parseFormula();
        logger.trace("Parsed {}: {} -> {}", cell.toQualifiedString(), rawFormula, root);
        return root;
    }

    /**
     * Position in the token list of a single parse.
     */
    private static final class Cursor {

        private final String body;
        private final List<FormulaToken> tokens;
        private final CellAddress cell;
        private int index;

        Cursor(String body, List<FormulaToken> tokens, CellAddress cell) {
            this.body = body;
            this.tokens = tokens;
            this.cell = cell;
        }

        FormulaNode parseFormula() {
            FormulaNode root = comparison();
            FormulaToken trailing = peek();
            if (!trailing.is(FormulaToken.Type.END)) {
                if (trailing.is(FormulaToken.Type.RIGHT_PAREN)) {
                    throw new UnsupportedFormulaException(cell, body.substring(trailing.getPosition()),
                            "unbalanced closing parenthesis");
                }
                throw new UnsupportedFormulaException(cell, body.substring(trailing.getPosition()),
                        "unexpected token");
            }
            return root;
        }

        private FormulaNode comparison() {
            FormulaNode left = concat();
            while (peek().is(FormulaToken.Type.OPERATOR)) {
                BinaryOperator operator = BinaryOperator.fromSymbol(peek().getText()).orElse(null);
                if (operator == null || !operator.isComparison()) {
                    break;
                }
                index++;
                left = new BinaryOpNode(operator, left, concat());
            }
            return left;
        }

        private FormulaNode concat() {
            FormulaNode left = expr();
            while (peek().isOperator("&")) {
                index++;
                left = new BinaryOpNode(BinaryOperator.CONCAT, left, expr());
            }
            return left;
        }

        private FormulaNode expr() {
            FormulaNode left = term();
            while (peek().isOperator("+") || peek().isOperator("-")) {
                BinaryOperator operator = peek().isOperator("+") ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
                index++;
                left = new BinaryOpNode(operator, left, term());
            }
            return left;
        }

        private FormulaNode term() {
            FormulaNode left = power();
            while (peek().isOperator("*") || peek().isOperator("/")) {
                BinaryOperator operator = peek().isOperator("*") ? BinaryOperator.MULTIPLY : BinaryOperator.DIVIDE;
                index++;
                left = new BinaryOpNode(operator, left, power());
            }
            return left;
        }

        private FormulaNode power() {
            FormulaNode left = unary();
            while (peek().isOperator("^")) {
                index++;
                left = new BinaryOpNode(BinaryOperator.POWER, left, unary());
            }
            return left;
        }

        private FormulaNode unary() {
            if (peek().isOperator("-")) {
                index++;
                return new UnaryOpNode(UnaryOperator.NEGATE, unary());
            }
            if (peek().isOperator("+")) {
                index++;
                return unary();
            }
            return factor();
        }

        private FormulaNode factor() {
            FormulaToken token = next();
            switch (token.getType()) {
                case NUMBER:
                    double number = Double.parseDouble(token.getText());
                    if (Double.isInfinite(number)) {
                        throw new UnsupportedFormulaException(cell, token.getText(), "number out of range");
                    }
                    return new LiteralNode(CellValue.ofNumber(number));
                case STRING:
                    return new LiteralNode(CellValue.ofString(token.getText()));
                case BOOLEAN:
                    return new LiteralNode(CellValue.ofBoolean(Boolean.parseBoolean(token.getText().toLowerCase())));
                case CELL_REF:
                    return new CellRefNode(CellAddress.parse(cell.getSheet(), token.getText()));
                case LEFT_PAREN:
                    FormulaNode inner = comparison();
                    if (!next().is(FormulaToken.Type.RIGHT_PAREN)) {
                        throw new UnsupportedFormulaException(cell, body.substring(token.getPosition()),
                                "missing closing parenthesis");
                    }
                    return inner;
                case END:
                    throw new UnsupportedFormulaException(cell, body, "incomplete expression");
                default:
                    throw new UnsupportedFormulaException(cell, body.substring(token.getPosition()),
                            "unexpected token");
            }
        }

        private FormulaToken peek() {
            return tokens.get(index);
        }

        private FormulaToken next() {
            FormulaToken token = tokens.get(index);
            if (!token.is(FormulaToken.Type.END)) {
                index++;
            }
            return token;
        }
    }
}
