package com.docparser.table.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One row of an extracted table
 * The row index is fixed at creation and survives empty-cell filtering
 */
public class TableRow {
    private final List<TableCell> cells;
    private final int rowIndex;
    private boolean header;

    public TableRow(int rowIndex) {
        this.rowIndex = rowIndex;
        this.cells = new ArrayList<>();
    }

    public TableRow(int rowIndex, List<TableCell> cells) {
        this.rowIndex = rowIndex;
        this.cells = cells != null ? new ArrayList<>(cells) : new ArrayList<>();
    }

    public void addCell(TableCell cell) {
        cells.add(cell != null ? cell : TableCell.empty());
    }

    public List<TableCell> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public TableCell getCell(int column) {
        return column >= 0 && column < cells.size() ? cells.get(column) : null;
    }

    public int getRowIndex() {
        return rowIndex;
    }

    public boolean isHeader() {
        return header;
    }

    public int cellCount() {
        return cells.size();
    }

    /**
     * True for a row without cells or with only empty cells
     */
    public boolean isEmpty() {
        return cells.stream().allMatch(TableCell::isEmpty);
    }

    public void markAsHeader() {
        this.header = true;
        for (TableCell cell : cells) {
            cell.setCellType(CellType.HEADER);
        }
    }

    public List<TableCell> nonEmptyCells() {
        return cells.stream().filter(cell -> !cell.isEmpty()).collect(Collectors.toList());
    }

    /**
     * Drop every empty cell, returning how many were removed
     */
    public int removeEmptyCells() {
        int before = cells.size();
        cells.removeIf(TableCell::isEmpty);
        return before - cells.size();
    }

    @Override
    public String toString() {
        return String.format("TableRow{index=%d, cells=%d, header=%s}", rowIndex, cells.size(), header);
    }
}
