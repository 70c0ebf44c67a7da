package com.catmepim.converter.sheetjs.codegen;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.sheetjs.model.CellValue;

import static org.junit.jupiter.api.Assertions.*;

class JsLiteralsTest {

    @Test
    void testNumbers() {
        assertEquals("10", JsLiterals.number(10.0));
        assertEquals("-3", JsLiterals.number(-3.0));
        assertEquals("0", JsLiterals.number(0.0));
        assertEquals("2.5", JsLiterals.number(2.5));
        assertEquals("0.1", JsLiterals.number(0.1));
        assertEquals("1.0E20", JsLiterals.number(1e20));
    }

    @Test
    void testStringsAreEscaped() {
        assertEquals("\"plain\"", JsLiterals.string("plain"));
        assertEquals("\"say \\\"hi\\\"\"", JsLiterals.string("say \"hi\""));
        assertEquals("\"a\\nb\\\\c\"", JsLiterals.string("a\nb\\c"));
        assertEquals("\"x\\u2028y\"", JsLiterals.string("x\u2028y"));
    }

    @Test
    void testCellValues() {
        assertEquals("42", JsLiterals.of(CellValue.ofNumber(42)));
        assertEquals("\"abc\"", JsLiterals.of(CellValue.ofString("abc")));
        assertEquals("true", JsLiterals.of(CellValue.ofBoolean(true)));
        assertEquals("false", JsLiterals.of(CellValue.ofBoolean(false)));
        assertEquals("null", JsLiterals.of(CellValue.empty()));
        assertEquals("\"#DIV/0!\"", JsLiterals.of(CellValue.ofError("#DIV/0!")));
    }
}
