package com.catmepim.converter.sheetjs.codegen;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellValue;

/**
 * Assembles the generated JavaScript text. Purely textual: ordering and reference resolution
 * have already been settled by the earlier stages.
 */
public class JsCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(JsCodeGenerator.class);

    static final String INDENT = "    ";

    /**
     * @param sheetName sheet the code is generated for
     * @param computedCells assignments in computation order
     * @param inputs input cells and their literal values, in the order they should be listed
     * @param includeTestCode whether to produce the verification snippet
     * @return the compiled sheet
     */
    public CompiledSheet generate(String sheetName, List<ComputedCell> computedCells,
                                  Map<CellAddress, CellValue> inputs, boolean includeTestCode) {
        return generate(sheetName, JsNames.functionName(sheetName), computedCells, inputs, includeTestCode);
    }

    /**
     * Regenerates {@code sheet} under another function name.
     */
    public CompiledSheet rename(CompiledSheet sheet, String functionName) {
        return generate(sheet.getSheetName(), functionName, sheet.getComputedCells(), sheet.getInputs(),
                sheet.getInvocationSource().isPresent());
    }

    private CompiledSheet generate(String sheetName, String functionName, List<ComputedCell> computedCells,
                                   Map<CellAddress, CellValue> inputs, boolean includeTestCode) {
        String functionSource = functionSource(functionName, computedCells);
        String inputObjectSource = inputObjectSource(inputs);
        String invocationSource = includeTestCode ? invocationSource(functionName, inputObjectSource) : null;
        logger.debug("Generated function {} for sheet '{}': {} assignments, {} inputs", functionName, sheetName,
                computedCells.size(), inputs.size());
        return new CompiledSheet(sheetName, functionName, functionSource, inputObjectSource, invocationSource,
                computedCells, inputs);
    }

    String functionSource(String functionName, List<ComputedCell> computedCells) {
        String computed = JsExpressionTranslator.COMPUTED_CONTAINER;
        StringBuilder js = new StringBuilder();
        js.append("function ").append(functionName).append('(').append(JsExpressionTranslator.INPUT_CONTAINER)
                .append(") {\n");
        js.append(INDENT).append("// ").append(JsExpressionTranslator.INPUT_CONTAINER)
                .append(" is an object containing input cell values\n");
        js.append(INDENT).append("let ").append(computed).append(" = {};\n");
        for (ComputedCell cell : computedCells) {
            js.append(INDENT).append(computed).append('[').append(JsLiterals.string(cell.getAddress().toString()))
                    .append("] = ").append(cell.getExpression()).append(";\n");
        }
        js.append(INDENT).append("return ").append(computed).append(";\n");
        js.append('}');
        return js.toString();
    }

    String inputObjectSource(Map<CellAddress, CellValue> inputs) {
        if (inputs.isEmpty()) {
            return "{}";
        }
        StringBuilder js = new StringBuilder("{\n");
        int remaining = inputs.size();
        for (Map.Entry<CellAddress, CellValue> input : inputs.entrySet()) {
            js.append(INDENT).append(JsLiterals.string(input.getKey().toString())).append(": ")
                    .append(JsLiterals.of(input.getValue()));
            js.append(--remaining > 0 ? ",\n" : "\n");
        }
        js.append('}');
        return js.toString();
    }

    String invocationSource(String functionName, String inputObjectSource) {
        String args = functionName + "_args";
        return "const " + args + " = " + inputObjectSource + ";\n\n"
                + "console.log(" + JsLiterals.string("Output for " + functionName + ": ") + ", "
                + functionName + "(" + args + "));";
    }
}
