package com.catmepim.converter.sheetjs.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.exception.ConversionException;

/**
 * Outcome of compiling several sheets: the sheets that compiled and, per failed sheet, the error
 * that stopped it.
 */
public final class WorkbookCompilationResult {

    private final List<CompiledSheet> compiledSheets;
    private final Map<String, ConversionException> failures;

    public WorkbookCompilationResult(List<CompiledSheet> compiledSheets, Map<String, ConversionException> failures) {
        this.compiledSheets = List.copyOf(compiledSheets);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * @return compiled sheets in processing order
     */
    public List<CompiledSheet> getCompiledSheets() {
        return compiledSheets;
    }

    /**
     * @return requested sheet name to failure, in processing order
     */
    public Map<String, ConversionException> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
