package com.catmepim.converter.sheetjs.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.codegen.CompiledSheet;
import com.catmepim.converter.sheetjs.codegen.ComputedCell;
import com.catmepim.converter.sheetjs.codegen.JsCodeGenerator;
import com.catmepim.converter.sheetjs.codegen.JsExpressionTranslator;
import com.catmepim.converter.sheetjs.formula.FormulaParser;
import com.catmepim.converter.sheetjs.formula.ReferenceCollector;
import com.catmepim.converter.sheetjs.formula.ast.FormulaNode;
import com.catmepim.converter.sheetjs.graph.DependencyGraph;
import com.catmepim.converter.sheetjs.graph.DependencyGraphBuilder;
import com.catmepim.converter.sheetjs.graph.TopologicalSorter;
import com.catmepim.converter.sheetjs.model.CellAddress;
import com.catmepim.converter.sheetjs.model.CellRecord;
import com.catmepim.converter.sheetjs.model.CellValue;
import com.catmepim.converter.sheetjs.model.SheetCells;

/**
 * Compiles the formula cells of one sheet into a JavaScript function in a single batch pass:
 * read cells, parse, build the dependency graph, sort, translate, generate.
 * <p>
 * Stateless apart from its collaborators; all per-run data travels in the
 * {@link CompilationContext} and is discarded once the {@link CompiledSheet} is built.
 *
 * @invariant a call either returns a complete {@link CompiledSheet} or throws; there is no
 *            partially compiled result
 */
public class SheetCompiler {

    private static final Logger logger = LoggerFactory.getLogger(SheetCompiler.class);

    private final FormulaParser parser;
    private final ReferenceCollector referenceCollector;
    private final DependencyGraphBuilder graphBuilder;
    private final TopologicalSorter sorter;
    private final JsCodeGenerator generator;

    public SheetCompiler() {
        this(new FormulaParser(), new ReferenceCollector(), new TopologicalSorter(), new JsCodeGenerator());
    }

    public SheetCompiler(FormulaParser parser, ReferenceCollector referenceCollector, TopologicalSorter sorter,
                         JsCodeGenerator generator) {
        this.parser = parser;
        this.referenceCollector = referenceCollector;
        this.graphBuilder = new DependencyGraphBuilder(referenceCollector);
        this.sorter = sorter;
        this.generator = generator;
    }

    /**
     * @param context sheet, bound and cell source of this compilation
     * @return the generated function and input object
     * @throws com.catmepim.converter.sheetjs.exception.SheetNotFoundException if the sheet does not exist
     * @throws com.catmepim.converter.sheetjs.exception.UnsupportedFormulaException if a formula of the
     *         region is outside the supported grammar
     * @throws com.catmepim.converter.sheetjs.exception.CircularDependencyException if the formulas of
     *         the region form a loop
     * @post every computed cell appears after all computed cells it reads; every input read by
     *       the function is present in the input object and no other cell is
     */
    public CompiledSheet compile(CompilationContext context) {
        long startTime = System.nanoTime();
        SheetCells cells = context.getSource().readSheet(context.getSheetName());
        CompilationContext sheetContext = context.forSheet(cells.getSheetName());
        String sheetName = sheetContext.getSheetName();

        Map<CellAddress, FormulaNode> formulas = new LinkedHashMap<>();
        Map<CellAddress, String> rawFormulas = new LinkedHashMap<>();
        for (CellRecord record : cells.getRecords()) {
            if (record.isFormula() && sheetContext.isInRegion(record.getAddress())) {
                formulas.put(record.getAddress(), parser.parse(record.getRawFormula(), record.getAddress()));
                rawFormulas.put(record.getAddress(), record.getRawFormula());
            }
        }
        logger.debug("Parsed {} formula cells of {}", formulas.size(), sheetContext);

        DependencyGraph graph = graphBuilder.build(sheetContext, formulas);
        List<CellAddress> order = sorter.sort(sheetName, graph);

        JsExpressionTranslator translator = new JsExpressionTranslator(graph.getNodes());
        List<ComputedCell> computedCells = new ArrayList<>(order.size());
        for (CellAddress address : order) {
            String expression = translator.translate(formulas.get(address));
            computedCells.add(new ComputedCell(address, rawFormulas.get(address), expression,
                    graph.getDependencies(address)));
            logger.trace("{}!{} = {}", sheetName, address, expression);
        }

        Map<CellAddress, CellValue> inputs = new TreeMap<>();
        for (FormulaNode formula : formulas.values()) {
            for (CellAddress reference : referenceCollector.collect(formula)) {
                if (!graph.isNode(reference)) {
                    inputs.put(reference, cells.valueAt(reference));
                }
            }
        }

        CompiledSheet compiled = generator.generate(sheetName, computedCells, inputs, context.isIncludeTestCode());
        logger.info("Compiled {} into function {}: {} computed cells, {} inputs in {} ms", sheetContext,
                compiled.getFunctionName(), computedCells.size(), inputs.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
        return compiled;
    }
}
