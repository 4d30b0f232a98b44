package com.docparser.table.header;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableRow;

import java.util.List;

/**
 * Signal: header labels are shorter than the values under them
 */
public class LengthPatternSignal implements HeaderSignal {

    private static final int SAMPLE_ROWS = 3;

    private static final double SHORTER_THAN_DATA_SCORE = 0.8;
    private static final double SHORT_LABELS_SCORE = 0.4;

    @Override
    public String name() {
        return "length_pattern";
    }

    @Override
    public double weight() {
        return 0.15;
    }

    @Override
    public double score(TableRow firstRow, List<TableRow> dataRows, CellTypeClassifier classifier) {
        if (dataRows.isEmpty()) {
            return 0.0;
        }

        double headerAverage = averageLength(firstRow);

        double dataAverage = 0.0;
        int sampled = 0;
        for (TableRow row : dataRows.subList(0, Math.min(SAMPLE_ROWS, dataRows.size()))) {
            if (row.cellCount() > 0) {
                dataAverage += averageLength(row);
                sampled++;
            }
        }

        if (sampled > 0) {
            dataAverage /= sampled;
            if (headerAverage > 0.0 && headerAverage < 50.0 && dataAverage >= headerAverage * 1.2) {
                return SHORTER_THAN_DATA_SCORE;
            }
        }

        return headerAverage > 0.0 && headerAverage < 30.0 ? SHORT_LABELS_SCORE : 0.0;
    }

    private static double averageLength(TableRow row) {
        if (row.cellCount() == 0) {
            return 0.0;
        }
        return row.getCells().stream().mapToInt(cell -> cell.contentLength()).sum() / (double) row.cellCount();
    }
}
