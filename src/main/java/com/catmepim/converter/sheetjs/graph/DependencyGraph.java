package com.catmepim.converter.sheetjs.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Adjacency mapping from each formula cell to the cells its formula reads, restricted to the
 * processed region. An edge {@code u -> v} means "u requires the value of v".
 * <p>
 * Plain data keyed by {@link CellAddress}; iteration is in row-major order so everything derived
 * from the graph is deterministic.
 *
 * @invariant every node is a formula cell of the region; targets may be formula or literal cells
 */
public final class DependencyGraph {

    private final Map<CellAddress, Set<CellAddress>> edges;

    /**
     * @param edges formula cell to referenced in-region cells; copied
     */
    public DependencyGraph(Map<CellAddress, ? extends Set<CellAddress>> edges) {
        Map<CellAddress, Set<CellAddress>> copy = new TreeMap<>();
        for (Map.Entry<CellAddress, ? extends Set<CellAddress>> entry : edges.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(new TreeSet<>(entry.getValue())));
        }
        this.edges = Collections.unmodifiableMap(new LinkedHashMap<>(copy));
    }

    /**
     * @return formula cells of the region in row-major order
     */
    public Set<CellAddress> getNodes() {
        return edges.keySet();
    }

    public boolean isNode(CellAddress address) {
        return edges.containsKey(address);
    }

    /**
     * @return cells {@code node} depends on, or an empty set if it is not a node
     */
    public Set<CellAddress> getDependencies(CellAddress node) {
        return edges.getOrDefault(node, Collections.emptySet());
    }

    public Map<CellAddress, Set<CellAddress>> asMap() {
        return edges;
    }

    public int size() {
        return edges.size();
    }

    @Override
    public String toString() {
        return edges.toString();
    }
}
