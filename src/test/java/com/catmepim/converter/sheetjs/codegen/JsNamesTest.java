package com.catmepim.converter.sheetjs.codegen;

import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class JsNamesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Sheet1        | Sheet1",
            "My Sheet      | MySheet",
            "Q1-Results    | Q1Results",
            "2024 Budget   | _2024Budget",
            "class         | _class",
            "'!!! ---'     | excelFunction",
            "$rates_v2     | $rates_v2",
            "Preisübersicht | Preisbersicht",
            "''             | excelFunction"
    })
    void testFunctionName(String sheetName, String expected) {
        assertEquals(expected, JsNames.functionName(sheetName));
    }

    @Test
    void testUniqueName() {
        assertEquals("Sheet1", JsNames.uniqueName("Sheet1", Set.of("Other")));
        assertEquals("Sheet1_2", JsNames.uniqueName("Sheet1", Set.of("Sheet1")));
        assertEquals("Sheet1_3", JsNames.uniqueName("Sheet1", Set.of("Sheet1", "Sheet1_2")));
    }
}
