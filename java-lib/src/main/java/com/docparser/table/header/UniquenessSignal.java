package com.docparser.table.header;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableRow;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Signal: column labels do not repeat
 */
public class UniquenessSignal implements HeaderSignal {

    @Override
    public String name() {
        return "uniqueness";
    }

    @Override
    public double weight() {
        return 0.10;
    }

    @Override
    public double score(TableRow firstRow, List<TableRow> dataRows, CellTypeClassifier classifier) {
        List<String> labels = firstRow.nonEmptyCells().stream()
                .map(TableCell::getContent)
                .map(content -> content.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        if (labels.isEmpty()) {
            return 0.0;
        }

        Set<String> unique = new HashSet<>(labels);
        return (double) unique.size() / labels.size();
    }
}
