package com.catmepim.converter.sheetjs.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellValue;

/**
 * Result of compiling one sheet: the generated function, its name, the literal input object and,
 * when requested, the verification snippet that calls the function with that object.
 *
 * @invariant {@code computedCells} is in computation order; {@code inputs} is in row-major order
 */
public final class CompiledSheet {

    private final String sheetName;
    private final String functionName;
    private final String functionSource;
    private final String inputObjectSource;
    private final String invocationSource;
    private final List<ComputedCell> computedCells;
    private final Map<CellAddress, CellValue> inputs;

    public CompiledSheet(String sheetName, String functionName, String functionSource, String inputObjectSource,
                         String invocationSource, List<ComputedCell> computedCells, Map<CellAddress, CellValue> inputs) {
        this.sheetName = sheetName;
        this.functionName = functionName;
        this.functionSource = functionSource;
        this.inputObjectSource = inputObjectSource;
        this.invocationSource = invocationSource;
        this.computedCells = List.copyOf(computedCells);
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public String getSheetName() {
        return sheetName;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getFunctionSource() {
        return functionSource;
    }

    public String getInputObjectSource() {
        return inputObjectSource;
    }

    /**
     * @return the verification snippet, present only when test code was requested
     */
    public Optional<String> getInvocationSource() {
        return Optional.ofNullable(invocationSource);
    }

    public List<ComputedCell> getComputedCells() {
        return computedCells;
    }

    public List<CellAddress> getComputationOrder() {
        return computedCells.stream().map(ComputedCell::getAddress).collect(Collectors.toList());
    }

    public Map<CellAddress, CellValue> getInputs() {
        return inputs;
    }
}
