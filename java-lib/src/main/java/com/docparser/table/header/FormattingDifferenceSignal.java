package com.docparser.table.header;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableRow;

import java.util.List;

/**
 * Signal: header cells are formatted differently from the cells below them
 *
 * Compares each first-row cell with the same column in the first three data
 * rows; a comparison counts when formatting presence or boldness differs.
 */
public class FormattingDifferenceSignal implements HeaderSignal {

    private static final int SAMPLE_ROWS = 3;

    @Override
    public String name() {
        return "formatting_difference";
    }

    @Override
    public double weight() {
        return 0.30;
    }

    @Override
    public double score(TableRow firstRow, List<TableRow> dataRows, CellTypeClassifier classifier) {
        if (dataRows.isEmpty()) {
            return 0.0;
        }

        int differences = 0;
        int comparisons = 0;
        List<TableRow> sample = dataRows.subList(0, Math.min(SAMPLE_ROWS, dataRows.size()));

        for (int column = 0; column < firstRow.cellCount(); column++) {
            TableCell headerCell = firstRow.getCell(column);
            for (TableRow dataRow : sample) {
                TableCell dataCell = dataRow.getCell(column);
                if (dataCell == null) {
                    continue;
                }
                comparisons++;
                if (headerCell.hasFormatting() != dataCell.hasFormatting()
                        || isBold(headerCell) != isBold(dataCell)) {
                    differences++;
                }
            }
        }

        return comparisons > 0 ? (double) differences / comparisons : 0.0;
    }

    private static boolean isBold(TableCell cell) {
        return cell.getFormatting() != null && cell.getFormatting().isBold();
    }
}
