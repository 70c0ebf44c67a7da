package com.catmepim.converter.sheetjs.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.catmepim.converter.sheetjs.model.CellAddress;

/**
 * Thrown when the formula cells of a sheet depend on each other in a loop.
 * <p>
 * The cycle is reported as an ordered list of addresses whose first element is repeated at the
 * end, so {@code A1 -> B1 -> A1} means A1 reads B1 and B1 reads A1.
 *
 * @invariant {@code getCycle().size() >= 2 && first element equals last element}
 */
public class CircularDependencyException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final String sheetName;
    private final transient List<CellAddress> cycle;

    public CircularDependencyException(String sheetName, List<CellAddress> cycle) {
        super("Circular dependency detected in sheet '" + sheetName + "': "
                + cycle.stream().map(CellAddress::toString).collect(Collectors.joining(" -> ")));
        this.sheetName = sheetName;
        this.cycle = List.copyOf(cycle);
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<CellAddress> getCycle() {
        return cycle;
    }
}
