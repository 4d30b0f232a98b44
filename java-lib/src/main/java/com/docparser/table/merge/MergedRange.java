package com.docparser.table.merge;

/**
 * A detected run of empty cells attributed to the non-empty cell before it
 * The anchor is always the cell at (startRow, startCol)
 */
final class MergedRange {
    private final int startRow;
    private final int endRow;
    private final int startCol;
    private final int endCol;
    private final MergeOrientation orientation;

    private MergedRange(int startRow, int endRow, int startCol, int endCol, MergeOrientation orientation) {
        this.startRow = startRow;
        this.endRow = endRow;
        this.startCol = startCol;
        this.endCol = endCol;
        this.orientation = orientation;
    }

    static MergedRange horizontal(int row, int startCol, int endCol) {
        return new MergedRange(row, row, startCol, endCol, MergeOrientation.HORIZONTAL);
    }

    static MergedRange vertical(int column, int startRow, int endRow) {
        return new MergedRange(startRow, endRow, column, column, MergeOrientation.VERTICAL);
    }

    int getStartRow() {
        return startRow;
    }

    int getEndRow() {
        return endRow;
    }

    int getStartCol() {
        return startCol;
    }

    int getEndCol() {
        return endCol;
    }

    MergeOrientation getOrientation() {
        return orientation;
    }

    /** Number of cells covered along the merge axis, anchor included */
    int span() {
        return orientation == MergeOrientation.HORIZONTAL ? endCol - startCol + 1 : endRow - startRow + 1;
    }

    boolean isAnchor(int row, int column) {
        return row == startRow && column == startCol;
    }

    @Override
    public String toString() {
        return String.format("MergedRange{%s, rows=%d..%d, cols=%d..%d}",
                orientation, startRow, endRow, startCol, endCol);
    }
}
