package com.docparser.table.merge;

import com.docparser.table.MergeCellsHandling;
import com.docparser.table.model.CellType;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Infers merged cells from runs of empty cells
 *
 * A run of empty cells directly after a non-empty cell, along a row or down a
 * column, is treated as one merged range anchored on that non-empty cell.
 * Rows are scanned first; a column run that touches any cell already covered
 * by a row run is dropped, so each cell belongs to at most one range.
 * Merges are inferred from content only, never from container metadata.
 */
public class MergedCellHandler {
    private static final Logger logger = LoggerFactory.getLogger(MergedCellHandler.class);

    /**
     * Apply the given policy to the table
     *
     * @return number of merged ranges found (0 for IGNORE)
     */
    public int handle(TableData table, MergeCellsHandling handling) {
        switch (handling) {
            case PRESERVE:
                return markMergedCells(table).size();
            case EXPAND:
                return expandMergedCells(table);
            case IGNORE:
            default:
                return 0;
        }
    }

    List<MergedRange> markMergedCells(TableData table) {
        List<MergedRange> ranges = detectRanges(table);
        for (MergedRange range : ranges) {
            apply(table, range);
        }
        return ranges;
    }

    private int expandMergedCells(TableData table) {
        List<MergedRange> ranges = markMergedCells(table);
        for (MergedRange range : ranges) {
            TableCell anchor = table.getCell(range.getStartRow(), range.getStartCol());
            for (int row = range.getStartRow(); row <= range.getEndRow(); row++) {
                CellType fillType = table.getRow(row).isHeader() ? CellType.HEADER : CellType.DATA;
                for (int column = range.getStartCol(); column <= range.getEndCol(); column++) {
                    TableCell cell = table.getCell(row, column);
                    if (cell != null && !range.isAnchor(row, column)) {
                        cell.fillFrom(anchor, fillType);
                    }
                }
            }
            anchor.clearMerge(table.getRow(range.getStartRow()).isHeader() ? CellType.HEADER : CellType.DATA);
        }
        return ranges.size();
    }

    List<MergedRange> detectRanges(TableData table) {
        List<MergedRange> horizontal = detectHorizontal(table);
        Set<Long> claimed = new HashSet<>();
        for (MergedRange range : horizontal) {
            for (int column = range.getStartCol(); column <= range.getEndCol(); column++) {
                claimed.add(key(range.getStartRow(), column));
            }
        }

        List<MergedRange> ranges = new ArrayList<>(horizontal);
        int vertical = 0;
        for (MergedRange range : detectVertical(table)) {
            if (!overlaps(range, claimed)) {
                ranges.add(range);
                vertical++;
            }
        }

        logger.debug("Detected {} horizontal and {} vertical merged ranges", horizontal.size(), vertical);
        return ranges;
    }

    private List<MergedRange> detectHorizontal(TableData table) {
        List<MergedRange> ranges = new ArrayList<>();
        List<TableRow> rows = table.getRows();

        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            List<TableCell> cells = rows.get(rowIndex).getCells();
            int start = -1;
            int end = -1;

            for (int column = 0; column < cells.size(); column++) {
                if (cells.get(column).isEmpty()) {
                    if (start >= 0) {
                        end = column;
                    } else if (column > 0 && !cells.get(column - 1).isEmpty()) {
                        start = column - 1;
                        end = column;
                    }
                } else if (start >= 0) {
                    ranges.add(MergedRange.horizontal(rowIndex, start, end));
                    start = -1;
                }
            }
            if (start >= 0) {
                ranges.add(MergedRange.horizontal(rowIndex, start, end));
            }
        }
        return ranges;
    }

    private List<MergedRange> detectVertical(TableData table) {
        List<MergedRange> ranges = new ArrayList<>();
        List<TableRow> rows = table.getRows();

        for (int column = 0; column < table.getColumnCount(); column++) {
            int start = -1;
            int end = -1;

            for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
                TableCell cell = rows.get(rowIndex).getCell(column);
                if (cell != null && cell.isEmpty()) {
                    if (start >= 0) {
                        end = rowIndex;
                    } else if (rowIndex > 0) {
                        TableCell above = rows.get(rowIndex - 1).getCell(column);
                        if (above != null && !above.isEmpty()) {
                            start = rowIndex - 1;
                            end = rowIndex;
                        }
                    }
                } else if (start >= 0) {
                    // a missing cell ends the run as well as a filled one
                    ranges.add(MergedRange.vertical(column, start, end));
                    start = -1;
                }
            }
            if (start >= 0) {
                ranges.add(MergedRange.vertical(column, start, end));
            }
        }
        return ranges;
    }

    private static void apply(TableData table, MergedRange range) {
        boolean horizontal = range.getOrientation() == MergeOrientation.HORIZONTAL;
        for (int row = range.getStartRow(); row <= range.getEndRow(); row++) {
            for (int column = range.getStartCol(); column <= range.getEndCol(); column++) {
                TableCell cell = table.getCell(row, column);
                if (cell == null) {
                    continue;
                }
                if (range.isAnchor(row, column)) {
                    cell.setMerged(horizontal ? range.span() : null, horizontal ? null : range.span());
                } else {
                    cell.setMerged(null, null);
                }
            }
        }
    }

    private static boolean overlaps(MergedRange range, Set<Long> claimed) {
        for (int row = range.getStartRow(); row <= range.getEndRow(); row++) {
            if (claimed.contains(key(row, range.getStartCol()))) {
                return true;
            }
        }
        return false;
    }

    private static long key(int row, int column) {
        return ((long) row << 32) | (column & 0xffffffffL);
    }
}
