package com.docparser.table.header;

import com.docparser.table.classify.CellDataType;
import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableRow;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Signal: the data rows below the candidate header hold one data type per column
 *
 * For every column the first five data rows are classified and the share of
 * the majority type is taken; the signal is the average over columns.
 */
public class DataTypeConsistencySignal implements HeaderSignal {

    private static final int SAMPLE_ROWS = 5;

    @Override
    public String name() {
        return "data_type_consistency";
    }

    @Override
    public double weight() {
        return 0.20;
    }

    @Override
    public double score(TableRow firstRow, List<TableRow> dataRows, CellTypeClassifier classifier) {
        if (dataRows.isEmpty()) {
            return 0.0;
        }

        int maxColumns = dataRows.stream().mapToInt(TableRow::cellCount).max().orElse(0);
        List<TableRow> sample = dataRows.subList(0, Math.min(SAMPLE_ROWS, dataRows.size()));

        double total = 0.0;
        int columns = 0;
        for (int column = 0; column < maxColumns; column++) {
            Map<CellDataType, Integer> counts = new EnumMap<>(CellDataType.class);
            int sampled = 0;
            for (TableRow row : sample) {
                TableCell cell = row.getCell(column);
                if (cell != null) {
                    counts.merge(classifier.classify(cell.getContent()), 1, Integer::sum);
                    sampled++;
                }
            }
            if (sampled > 0) {
                int majority = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
                total += (double) majority / sampled;
                columns++;
            }
        }

        return columns > 0 ? total / columns : 0.0;
    }
}
