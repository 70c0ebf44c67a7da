package com.catmepim.converter.sheetjs.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.core.CompilationContext;
import com.catmepim.converter.sheetjs.formula.ReferenceCollector;
import com.catmepim.converter.sheetjs.formula.ast.FormulaNode;
import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Builds the {@link DependencyGraph} of a sheet from its parsed formulas.
 */
public class DependencyGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final ReferenceCollector referenceCollector;

    public DependencyGraphBuilder() {
        this(new ReferenceCollector());
    }

    public DependencyGraphBuilder(ReferenceCollector referenceCollector) {
        this.referenceCollector = referenceCollector;
    }

    /**
     * References outside the bound or on another sheet are not edges; they are inputs of the
     * generated function. References to cells that do not exist are not an error either.
     *
     * @param context the compilation context supplying sheet and bound
     * @param formulas parsed formula of every formula cell in the region
     * @return the graph, one node per entry of {@code formulas}
     * @pre every key of {@code formulas} is in the region of {@code context}
     */
    public DependencyGraph build(CompilationContext context, Map<CellAddress, FormulaNode> formulas) {
        Map<CellAddress, Set<CellAddress>> edges = new LinkedHashMap<>();
        int external = 0;
        for (Map.Entry<CellAddress, FormulaNode> entry : formulas.entrySet()) {
            Set<CellAddress> dependencies = new TreeSet<>();
            for (CellAddress reference : referenceCollector.collect(entry.getValue())) {
                if (context.isInRegion(reference)) {
                    dependencies.add(reference);
                } else {
                    external++;
                    logger.trace("{} reads {} outside {}; treated as input", entry.getKey(), reference, context);
                }
            }
            edges.put(entry.getKey(), dependencies);
        }
        DependencyGraph graph = new DependencyGraph(edges);
        logger.debug("Dependency graph for {}: {} nodes, {} references outside the region", context, graph.size(),
                external);
        return graph;
    }
}
