package com.catmepim.converter.sheetjs.core;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.codegen.JsCodeGenerator;
import com.catmepim.converter.sheetjs.codegen.JsNames;
import com.catmepim.converter.sheetjs.exception.CircularDependencyException;
import com.catmepim.converter.sheetjs.exception.ConversionException;
import com.catmepim.converter.sheetjs.exception.SheetNotFoundException;
import com.catmepim.converter.sheetjs.exception.UnsupportedFormulaException;
import com.catmepim.converter.sheetjs.model.CellRange;
import com.catmepim.converter.sheetjs.source.CellSource;

/**
 * Compiles the requested sheets of a workbook one after another, each in its own
 * {@link CompilationContext}.
 * <p>
 * A missing sheet, an unsupported formula or a circular dependency only fails the owning sheet;
 * any other error aborts the whole run.
 */
public class WorkbookCompiler {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookCompiler.class);

    private final SheetCompiler sheetCompiler;
    private final JsCodeGenerator generator;

    public WorkbookCompiler() {
        this(new SheetCompiler(), new JsCodeGenerator());
    }

    public WorkbookCompiler(SheetCompiler sheetCompiler, JsCodeGenerator generator) {
        this.sheetCompiler = sheetCompiler;
        this.generator = generator;
    }

    /**
     * @param source open workbook
     * @param sheetNames sheets to compile in this order; {@code null} or empty for every sheet
     * @param bound region to compile in each sheet, or {@code null} for whole sheets
     * @param includeTestCode whether to produce verification snippets
     * @return compiled sheets and per-sheet failures
     * @post function names of the compiled sheets are pairwise distinct
     */
    public WorkbookCompilationResult compile(CellSource source, List<String> sheetNames, CellRange bound,
                                             boolean includeTestCode) {
        List<String> targets = (sheetNames == null || sheetNames.isEmpty()) ? source.getSheetNames() : sheetNames;
        logger.info("Compiling {} sheet(s): {}", targets.size(), targets);

        List<CompiledSheet> compiled = new ArrayList<>();
        Map<String, ConversionException> failures = new LinkedHashMap<>();
        Set<String> functionNames = new HashSet<>();
        for (String sheetName : targets) {
            CompilationContext context = new CompilationContext(source, sheetName, bound, includeTestCode);
            try {
                CompiledSheet sheet = sheetCompiler.compile(context);
                String functionName = JsNames.uniqueName(sheet.getFunctionName(), functionNames);
                if (!functionName.equals(sheet.getFunctionName())) {
                    logger.warn("Function name {} of sheet '{}' is already used; renamed to {}",
                            sheet.getFunctionName(), sheet.getSheetName(), functionName);
                    sheet = generator.rename(sheet, functionName);
                }
                functionNames.add(functionName);
                compiled.add(sheet);
            } catch (SheetNotFoundException | UnsupportedFormulaException | CircularDependencyException e) {
                logger.error("Error processing sheet '{}': {}", sheetName, e.getMessage());
                failures.put(sheetName, e);
            }
        }
        logger.info("Compiled {} of {} sheet(s)", compiled.size(), targets.size());
        return new WorkbookCompilationResult(compiled, failures);
    }
}
