package com.docparser.table.header;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides whether the first row of a table is a header row
 *
 * Combines independent {@link HeaderSignal}s as a weighted average:
 * confidence = sum(score_i * weight_i) / sum(weight_i)
 * and declares a header when the confidence exceeds {@link #HEADER_THRESHOLD}.
 */
public class HeaderDetector {
    private static final Logger logger = LoggerFactory.getLogger(HeaderDetector.class);

    public static final double HEADER_THRESHOLD = 0.6;

    private final List<HeaderSignal> signals;

    public HeaderDetector() {
        this(defaultSignals());
    }

    public HeaderDetector(List<HeaderSignal> signals) {
        this.signals = List.copyOf(signals);
    }

    /**
     * Formatting difference (0.30), content pattern (0.25), data type
     * consistency (0.20), length pattern (0.15), uniqueness (0.10)
     */
    public static List<HeaderSignal> defaultSignals() {
        List<HeaderSignal> signals = new ArrayList<>();
        signals.add(new FormattingDifferenceSignal());
        signals.add(new ContentPatternSignal());
        signals.add(new DataTypeConsistencySignal());
        signals.add(new LengthPatternSignal());
        signals.add(new UniquenessSignal());
        return signals;
    }

    public List<HeaderSignal> getSignals() {
        return signals;
    }

    /**
     * Weighted confidence that row 0 is a header; 0 for an empty table
     */
    public double confidence(TableData table, CellTypeClassifier classifier) {
        if (table.isEmpty()) {
            return 0.0;
        }

        List<TableRow> rows = table.getRows();
        TableRow firstRow = rows.get(0);
        List<TableRow> dataRows = rows.subList(1, rows.size());

        double weighted = 0.0;
        double totalWeight = 0.0;
        for (HeaderSignal signal : signals) {
            double score = signal.score(firstRow, dataRows, classifier);
            logger.debug("Header signal {} scored {} (weight {})", signal.name(), score, signal.weight());
            weighted += score * signal.weight();
            totalWeight += signal.weight();
        }

        return totalWeight > 0.0 ? weighted / totalWeight : 0.0;
    }

    /**
     * Detect and apply a header row
     *
     * On success the first row's contents become the table headers and its
     * cells are typed as headers. Tables without rows are left untouched, and
     * a table that already carries a confidence is not scored again.
     *
     * @return whether the table has a header row afterwards
     */
    public boolean detect(TableData table, CellTypeClassifier classifier) {
        if (table.isEmpty()) {
            return false;
        }
        if (table.getHeaderConfidence() != null) {
            return table.hasHeader();
        }

        double confidence = confidence(table, classifier);
        table.setHeaderConfidence(confidence);
        logger.debug("Header confidence {} for table '{}'", confidence, table.getTitle());

        if (confidence <= HEADER_THRESHOLD) {
            return false;
        }

        TableRow firstRow = table.getRow(0);
        table.setHeaders(firstRow.getCells().stream()
                .map(TableCell::getContent)
                .collect(Collectors.toList()));
        firstRow.markAsHeader();
        return true;
    }
}
