package com.catmepim.converter.sheetjs.formula;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

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

import static com.catmepim.converter.sheetjs.support.Cells.at;
import static org.junit.jupiter.api.Assertions.*;

class FormulaParserTest {

    private final FormulaParser parser = new FormulaParser();
    private final CellAddress owner = at("D4");

    private FormulaNode parse(String formula) {
        return parser.parse(formula, owner);
    }

    private static FormulaNode ref(String a1) {
        return new CellRefNode(at(a1));
    }

    private static FormulaNode num(double value) {
        return new LiteralNode(CellValue.ofNumber(value));
    }

    private static FormulaNode op(BinaryOperator operator, FormulaNode left, FormulaNode right) {
        return new BinaryOpNode(operator, left, right);
    }

    @Test
    void testSingleReferenceAndLiteral() {
        assertEquals(ref("A1"), parse("=A1"));
        assertEquals(num(42), parse("=42"));
        assertEquals(num(0.5), parse("=.5"));
        assertEquals(num(1500), parse("=1.5E3"));
        assertEquals(num(0.0025), parse("=2.5e-3"));
    }

    @Test
    void testLeadingEqualsIsOptional() {
        assertEquals(parse("=A1*2"), parse("A1*2"));
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        assertEquals(op(BinaryOperator.ADD, ref("A1"), op(BinaryOperator.MULTIPLY, ref("B1"), ref("C1"))),
                parse("=A1+B1*C1"));
    }

    @Test
    void testParenthesesOnlyShapeTheTree() {
        assertEquals(op(BinaryOperator.MULTIPLY, op(BinaryOperator.ADD, ref("A1"), ref("B1")), ref("C1")),
                parse("=(A1+B1)*C1"));
        assertEquals(ref("A1"), parse("=((A1))"));
    }

    @Test
    void testOperatorsAreLeftAssociative() {
        assertEquals(op(BinaryOperator.SUBTRACT, op(BinaryOperator.SUBTRACT, ref("A1"), ref("B1")), ref("C1")),
                parse("=A1-B1-C1"));
        assertEquals(op(BinaryOperator.DIVIDE, op(BinaryOperator.DIVIDE, num(8), num(4)), num(2)),
                parse("=8/4/2"));
    }

    @Test
    void testAbsoluteMarkersAreIgnored() {
        assertEquals(op(BinaryOperator.ADD, ref("A1"), ref("B2")), parse("=$A$1 + B$2"));
    }

    @Test
    void testReferencesResolveToTheOwnersSheet() {
        FormulaNode node = parser.parse("=A1", CellAddress.parse("Budget", "C1"));
        assertEquals(new CellRefNode(CellAddress.parse("Budget", "A1")), node);
    }

    @Test
    void testUnaryMinusBindsTighterThanPower() {
        assertEquals(op(BinaryOperator.POWER, new UnaryOpNode(UnaryOperator.NEGATE, num(2)), num(2)),
                parse("=-2^2"));
        assertEquals(ref("A1"), parse("=+A1"));
        assertEquals(op(BinaryOperator.SUBTRACT, ref("A1"), new UnaryOpNode(UnaryOperator.NEGATE, ref("B1"))),
                parse("=A1--B1"));
    }

    @Test
    void testComparisonHasLowestPrecedence() {
        assertEquals(op(BinaryOperator.GREATER_OR_EQUAL, op(BinaryOperator.ADD, ref("A1"), num(1)), ref("B1")),
                parse("=A1+1>=B1"));
        assertEquals(op(BinaryOperator.NOT_EQUAL, ref("A1"), ref("B1")), parse("=A1<>B1"));
        assertEquals(op(BinaryOperator.EQUAL, ref("A1"), num(3)), parse("=A1=3"));
    }

    @Test
    void testStringsBooleansAndConcatenation() {
        assertEquals(op(BinaryOperator.CONCAT, new LiteralNode(CellValue.ofString("say \"hi\"")), ref("A1")),
                parse("=\"say \"\"hi\"\"\" & A1"));
        assertEquals(new LiteralNode(CellValue.ofBoolean(true)), parse("=true"));
        assertEquals(new LiteralNode(CellValue.ofBoolean(false)), parse("=FALSE"));
    }

    @Test
    void testFunctionCallNamesCellAndFunction() {
        UnsupportedFormulaException ex = assertThrows(UnsupportedFormulaException.class,
                () -> parse("=SUM(A1,B1)"));
        assertEquals(owner, ex.getCell());
        assertEquals("SUM(", ex.getFragment());
        assertTrue(ex.getMessage().contains("Sheet1!D4"));
    }

    @Test
    void testRangeReferenceIsUnsupported() {
        UnsupportedFormulaException ex = assertThrows(UnsupportedFormulaException.class,
                () -> parse("=A1:B2*2"));
        assertEquals("A1:B2", ex.getFragment());
        assertEquals("$A$1:$B$2",
                assertThrows(UnsupportedFormulaException.class, () -> parse("=1+$A$1:$B$2")).getFragment());
        assertEquals("1:3", assertThrows(UnsupportedFormulaException.class, () -> parse("=1:3")).getFragment());
    }

    @Test
    void testCrossSheetReferencesAreUnsupported() {
        assertEquals("Sheet2!A1",
                assertThrows(UnsupportedFormulaException.class, () -> parse("=Sheet2!A1+1")).getFragment());
        assertEquals("'My Sheet'!B3",
                assertThrows(UnsupportedFormulaException.class, () -> parse("='My Sheet'!B3")).getFragment());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "=TaxRate*A1      | TaxRate",
            "=A1*10%          | %",
            "={1,2,3}         | '{1,2,3}'",
            "=#REF!+1         | #REF",
            "=A1;B1           | ;",
            "=A1 B1           | B1",
            "=(A1+B1          | (A1+B1",
            "=A1+B1)          | )",
            "=A1*             | A1*",
            "=\"unterminated  | \"unterminated",
            "=A1*1e999        | 1e999",
            "=12AB            | 12AB"
    })
    void testUnsupportedSyntaxNamesTheFragment(String formula, String fragment) {
        UnsupportedFormulaException ex = assertThrows(UnsupportedFormulaException.class, () -> parse(formula));
        assertEquals(fragment, ex.getFragment());
        assertEquals(owner, ex.getCell());
    }

    @Test
    void testEmptyFormulaIsUnsupported() {
        assertThrows(UnsupportedFormulaException.class, () -> parse("="));
        assertThrows(UnsupportedFormulaException.class, () -> parse("   "));
    }
}
