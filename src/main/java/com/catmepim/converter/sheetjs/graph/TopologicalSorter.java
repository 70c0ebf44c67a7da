package com.catmepim.converter.sheetjs.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catmepim.converter.sheetjs.exception.CircularDependencyException;
import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Linearises a {@link DependencyGraph} into a computation order (Kahn's algorithm).
 * <p>
 * A cell becomes eligible once every formula cell it depends on has been placed; among eligible
 * cells the one with the lowest row-major position is placed first, so the same graph always
 * yields the same order.
 */
public class TopologicalSorter {

    private static final Logger logger = LoggerFactory.getLogger(TopologicalSorter.class);

    /**
     * @param sheetName sheet of the graph, used in the error message
     * @param graph the dependency graph
     * @return every node of {@code graph}, each after all nodes it depends on
     * @throws CircularDependencyException if the nodes depend on each other in a loop
     * @post for every edge {@code u -> v} between nodes, {@code v} precedes {@code u}
     */
    public List<CellAddress> sort(String sheetName, DependencyGraph graph) {
        Map<CellAddress, Integer> pending = new HashMap<>();
        Map<CellAddress, List<CellAddress>> dependents = new HashMap<>();
        for (CellAddress node : graph.getNodes()) {
            int count = 0;
            for (CellAddress dependency : graph.getDependencies(node)) {
                if (graph.isNode(dependency)) {
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(node);
                    count++;
                }
            }
            pending.put(node, count);
        }

        PriorityQueue<CellAddress> eligible = new PriorityQueue<>();
        for (Map.Entry<CellAddress, Integer> entry : pending.entrySet()) {
            if (entry.getValue() == 0) {
                eligible.add(entry.getKey());
            }
        }

        List<CellAddress> order = new ArrayList<>(graph.size());
        while (!eligible.isEmpty()) {
            CellAddress node = eligible.poll();
            order.add(node);
            for (CellAddress dependent : dependents.getOrDefault(node, Collections.emptyList())) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    eligible.add(dependent);
                }
            }
        }

        if (order.size() != graph.size()) {
            Set<CellAddress> unplaced = new TreeSet<>(graph.getNodes());
            unplaced.removeAll(order);
            List<CellAddress> cycle = findCycle(graph, unplaced);
            logger.debug("{} of {} formula cells in sheet '{}' could not be ordered: {}", unplaced.size(),
                    graph.size(), sheetName, unplaced);
            throw new CircularDependencyException(sheetName, cycle);
        }
        logger.debug("Computation order for sheet '{}': {}", sheetName, order);
        return Collections.unmodifiableList(order);
    }

    /**
     * Walks dependencies among the unplaced cells until a cell repeats. Every unplaced cell has at
     * least one unplaced dependency, so the walk always closes a loop.
     *
     * @return the loop, starting and ending with the same cell
     */
    private List<CellAddress> findCycle(DependencyGraph graph, Set<CellAddress> unplaced) {
        Map<CellAddress, CellAddress> next = new TreeMap<>();
        for (CellAddress node : unplaced) {
            for (CellAddress dependency : graph.getDependencies(node)) {
                if (unplaced.contains(dependency)) {
                    next.put(node, dependency);
                    break;
                }
            }
        }
        LinkedHashSet<CellAddress> path = new LinkedHashSet<>();
        CellAddress current = unplaced.iterator().next();
        while (path.add(current)) {
            current = next.get(current);
        }
        List<CellAddress> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (CellAddress step : path) {
            inCycle = inCycle || step.equals(current);
            if (inCycle) {
                cycle.add(step);
            }
        }
        cycle.add(current);
        return cycle;
    }
}
