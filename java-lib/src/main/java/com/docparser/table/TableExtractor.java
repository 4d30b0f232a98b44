package com.docparser.table;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.header.HeaderDetector;
import com.docparser.table.merge.MergedCellHandler;
import com.docparser.table.model.CellFormatting;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns a grid of raw cell text into an annotated {@link TableData}
 *
 * Pipeline, in this order: build rows, update statistics, detect the header
 * row, handle merged cells, drop empty cells. The configuration is passed in
 * on every call; the extractor keeps no per-table state, so one instance can
 * serve any number of threads.
 */
public class TableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TableExtractor.class);

    private final HeaderDetector headerDetector;
    private final MergedCellHandler mergedCellHandler;

    public TableExtractor() {
        this(new HeaderDetector(), new MergedCellHandler());
    }

    public TableExtractor(HeaderDetector headerDetector, MergedCellHandler mergedCellHandler) {
        this.headerDetector = headerDetector;
        this.mergedCellHandler = mergedCellHandler;
    }

    /**
     * Extract a table from raw cells
     *
     * Rows may differ in length; null rows and cells count as empty.
     *
     * @throws TableExtractionException if the grid cannot be traversed
     */
    public TableData extract(List<? extends List<RawCell>> grid, TableExtractionConfig config)
            throws TableExtractionException {
        TableData table = build(grid, config);
        return process(table, config);
    }

    /**
     * Extract a table from plain cell strings
     */
    public TableData extractText(List<? extends List<String>> grid, TableExtractionConfig config)
            throws TableExtractionException {
        if (grid == null) {
            throw new TableExtractionException("Table extraction failed: grid is null");
        }
        List<List<RawCell>> cells = new ArrayList<>(grid.size());
        for (List<String> row : grid) {
            cells.add(row == null ? List.of() : row.stream().map(RawCell::new).collect(Collectors.toList()));
        }
        return extract(cells, config);
    }

    public TableData extractText(String[][] grid, TableExtractionConfig config) throws TableExtractionException {
        if (grid == null) {
            throw new TableExtractionException("Table extraction failed: grid is null");
        }
        List<List<String>> rows = new ArrayList<>(grid.length);
        for (String[] row : grid) {
            rows.add(row == null ? List.of() : Arrays.asList(row));
        }
        return extractText(rows, config);
    }

    /**
     * Run the inference passes over an already built table
     * Running it again on its own output leaves headers and merged cells as they are.
     */
    public TableData process(TableData table, TableExtractionConfig config) {
        table.updateStatistics();
        logger.debug("Processing table with {} rows and {} columns", table.getRowCount(), table.getColumnCount());

        if (config.isDetectHeaders()) {
            boolean header = headerDetector.detect(table, CellTypeClassifier.of(config.isBinaryDigitsAsBoolean()));
            logger.debug("Header row detected: {}", header);
        }

        int ranges = mergedCellHandler.handle(table, config.getMergeCellsHandling());
        logger.debug("Merged cell handling {} found {} ranges", config.getMergeCellsHandling(), ranges);

        if (!config.isIncludeEmptyCells()) {
            int removed = filterEmptyCells(table);
            logger.debug("Removed {} empty cells", removed);
        }

        return table;
    }

    /**
     * Remove empty cells from every row and recompute the column count
     *
     * @return number of cells removed
     */
    public int filterEmptyCells(TableData table) {
        int removed = 0;
        for (TableRow row : table.getRows()) {
            removed += row.removeEmptyCells();
        }
        table.updateStatistics();
        return removed;
    }

    private TableData build(List<? extends List<RawCell>> grid, TableExtractionConfig config)
            throws TableExtractionException {
        if (grid == null) {
            throw new TableExtractionException("Table extraction failed: grid is null");
        }

        try {
            TableData table = new TableData();
            int rowIndex = 0;
            for (List<RawCell> rawRow : grid) {
                TableRow row = new TableRow(rowIndex++);
                if (rawRow != null) {
                    for (RawCell rawCell : rawRow) {
                        row.addCell(buildCell(rawCell, config));
                    }
                }
                table.addRow(row);
            }
            return table;
        } catch (RuntimeException e) {
            throw new TableExtractionException("Table extraction failed: " + e.getMessage(), e);
        }
    }

    private static TableCell buildCell(RawCell rawCell, TableExtractionConfig config) {
        if (rawCell == null) {
            return TableCell.empty();
        }

        CellFormatting formatting = rawCell.getFormatting();
        if (!config.isPreserveFormatting() || formatting == null || !formatting.hasFormatting()) {
            return new TableCell(rawCell.getText());
        }

        TableCell cell = new TableCell(rawCell.getText(), formatting);
        cell.setFormattedContent(formatting.applyToText(cell.getContent()));
        return cell;
    }
}
