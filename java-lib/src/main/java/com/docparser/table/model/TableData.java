package com.docparser.table.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tabular data extracted from a document, annotated with inferred structure
 * Row and column counts are derived values; {@link #updateStatistics()}
 * recomputes them from the rows
 */
public class TableData {
    private final List<TableRow> rows;
    private List<String> headers;
    private boolean hasHeader;
    private Double headerConfidence;
    private int rowCount;
    private int columnCount;
    private String tableId;
    private String title;

    public TableData() {
        this.rows = new ArrayList<>();
    }

    public TableData(String title) {
        this();
        this.title = title;
    }

    /**
     * Stand-in for a table that could not be extracted
     */
    public static TableData placeholder(int rawRowCount) {
        return new TableData(String.format("[Table with %d rows]", rawRowCount));
    }

    public void addRow(TableRow row) {
        rows.add(row);
        rowCount = rows.size();
        columnCount = Math.max(columnCount, row.cellCount());
    }

    public void updateStatistics() {
        rowCount = rows.size();
        columnCount = rows.stream().mapToInt(TableRow::cellCount).max().orElse(0);
    }

    public List<TableRow> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public TableRow getRow(int row) {
        return row >= 0 && row < rows.size() ? rows.get(row) : null;
    }

    public TableCell getCell(int row, int column) {
        TableRow tableRow = getRow(row);
        return tableRow != null ? tableRow.getCell(column) : null;
    }

    /**
     * Cells of one column, top to bottom; rows too short for the column
     * contribute null
     */
    public List<TableCell> getColumn(int column) {
        return rows.stream().map(row -> row.getCell(column)).collect(Collectors.toList());
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<String> getHeaders() {
        return headers;
    }

    public boolean hasHeader() {
        return hasHeader;
    }

    public void setHeaders(List<String> headers) {
        this.headers = headers != null ? List.copyOf(headers) : null;
        this.hasHeader = headers != null;
    }

    /** Confidence of the last header detection, null if it never ran */
    public Double getHeaderConfidence() {
        return headerConfidence;
    }

    public void setHeaderConfidence(Double headerConfidence) {
        this.headerConfidence = headerConfidence;
    }

    public String getTableId() {
        return tableId;
    }

    public void setTableId(String tableId) {
        this.tableId = tableId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public boolean hasTitle() {
        return title != null && !title.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("TableData{title='%s', rows=%d, columns=%d, hasHeader=%s}",
                title != null ? title : "", rowCount, columnCount, hasHeader);
    }
}
