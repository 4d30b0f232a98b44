package com.docparser.table.header;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableRow;

import java.util.List;

/**
 * One piece of evidence that the first row of a table is a header row
 *
 * Each signal returns a score in [0, 1]; {@link HeaderDetector} combines the
 * scores as a weighted average. A signal that lacks the data it needs
 * (no formatting, no data rows) returns 0 rather than failing.
 */
public interface HeaderSignal {

    /**
     * Signal name, used in logs
     */
    String name();

    /**
     * Relative weight of this signal in the combined confidence
     */
    double weight();

    /**
     * @param firstRow   candidate header row
     * @param dataRows   the rows after it, possibly empty
     * @param classifier cell type classifier for signals that look at data types
     * @return score in [0, 1]
     */
    double score(TableRow firstRow, List<TableRow> dataRows, CellTypeClassifier classifier);
}
