package com.catmepim.converter.sheetjs.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fully materialised cell records of one sheet, in row-major order.
 *
 * @invariant every record belongs to {@code sheetName}; no address appears twice
 */
public final class SheetCells {

    private final String sheetName;
    private final List<CellRecord> records;
    private final Map<CellAddress, CellRecord> byAddress;

    /**
     * @throws IllegalArgumentException if a record belongs to another sheet or an address repeats
     */
    public SheetCells(String sheetName, List<CellRecord> records) {
        this.sheetName = sheetName;
        List<CellRecord> sorted = new ArrayList<>(records);
        sorted.sort((a, b) -> a.getAddress().compareTo(b.getAddress()));
        Map<CellAddress, CellRecord> index = new LinkedHashMap<>();
        for (CellRecord record : sorted) {
            if (!record.getAddress().getSheet().equals(sheetName)) {
                throw new IllegalArgumentException("Cell " + record.getAddress().toQualifiedString()
                        + " does not belong to sheet '" + sheetName + "'");
            }
            if (index.put(record.getAddress(), record) != null) {
                throw new IllegalArgumentException("Duplicate cell " + record.getAddress().toQualifiedString());
            }
        }
        this.records = Collections.unmodifiableList(sorted);
        this.byAddress = Collections.unmodifiableMap(index);
    }

    public String getSheetName() {
        return sheetName;
    }

    public List<CellRecord> getRecords() {
        return records;
    }

    public Optional<CellRecord> find(CellAddress address) {
        return Optional.ofNullable(byAddress.get(address));
    }

    /**
     * @return the cell's literal value (cached result for formulas), or empty for unknown cells
     */
    public CellValue valueAt(CellAddress address) {
        CellRecord record = byAddress.get(address);
        return record == null ? CellValue.empty() : record.getValue();
    }

    public int size() {
        return records.size();
    }
}
