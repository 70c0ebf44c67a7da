package com.catmepim.converter.sheetjs.model;

import org.junit.jupiter.api.Test;

import com.catmepim.converter.sheetjs.exception.InvalidRangeException;

import static org.junit.jupiter.api.Assertions.*;

class CellRangeTest {

    @Test
    void testNoBoundsMeansWholeSheet() {
        assertTrue(CellRange.fromBounds(null, null).isEmpty());
        assertTrue(CellRange.fromBounds("", "  ").isEmpty());
    }

    @Test
    void testContainsIsInclusiveAndIgnoresSheet() {
        CellRange range = CellRange.fromBounds("A1", "B2").orElseThrow();
        assertTrue(range.contains(CellAddress.parse("Any", "A1")));
        assertTrue(range.contains(CellAddress.parse("Any", "B2")));
        assertTrue(range.contains(CellAddress.parse("Other", "B1")));
        assertFalse(range.contains(CellAddress.parse("Any", "C5")));
        assertFalse(range.contains(CellAddress.parse("Any", "B3")));
        assertEquals("A1:B2", range.toString());
    }

    @Test
    void testMissingSideDefaultsToGridEdge() {
        CellRange fromC3 = CellRange.fromBounds("C3", null).orElseThrow();
        assertEquals("XFD1048576", fromC3.getMax().toString());
        assertFalse(fromC3.contains(CellAddress.parse("S", "B3")));
        assertTrue(fromC3.contains(CellAddress.parse("S", "Z100")));

        CellRange upToB2 = CellRange.fromBounds(null, "B2").orElseThrow();
        assertEquals("A1", upToB2.getMin().toString());
    }

    @Test
    void testMalformedBoundsAreRejected() {
        InvalidRangeException malformed = assertThrows(InvalidRangeException.class,
                () -> CellRange.fromBounds("A1", "B"));
        assertTrue(malformed.getMessage().contains("'B'"));
        assertThrows(InvalidRangeException.class, () -> CellRange.fromBounds("1A", null));
    }

    @Test
    void testMinAfterMaxIsRejected() {
        assertThrows(InvalidRangeException.class, () -> CellRange.fromBounds("C1", "A5"));
        assertThrows(InvalidRangeException.class, () -> CellRange.fromBounds("A5", "C1"));
    }
}
