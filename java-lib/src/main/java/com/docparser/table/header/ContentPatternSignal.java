package com.docparser.table.header;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableRow;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Signal: first-row cells read like column labels
 *
 * Every cell adds one indicator for each of: a typical header keyword, a short
 * label without long digit runs, a capitalized word. The score is the indicator
 * total over the cell count, capped at 1.
 */
public class ContentPatternSignal implements HeaderSignal {

    private static final List<String> HEADER_KEYWORDS = List.of(
            "name", "id", "title", "date", "time", "type", "status",
            "amount", "count", "number", "code", "description");

    /** Exclusive bounds on the label length in characters */
    private static final int MIN_LABEL_LENGTH = 2;
    private static final int MAX_LABEL_LENGTH = 30;

    private static final Pattern LONG_DIGIT_RUN = Pattern.compile("\\d{4,}");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String name() {
        return "content_pattern";
    }

    @Override
    public double weight() {
        return 0.25;
    }

    @Override
    public double score(TableRow firstRow, List<TableRow> dataRows, CellTypeClassifier classifier) {
        int total = firstRow.cellCount();
        if (total == 0) {
            return 0.0;
        }

        int indicators = 0;
        for (TableCell cell : firstRow.getCells()) {
            indicators += indicatorCount(cell.getContent());
        }
        return Math.min(1.0, (double) indicators / total);
    }

    /**
     * Number of header indicators (0 to 3) found in one cell
     */
    static int indicatorCount(String content) {
        if (content.isEmpty()) {
            return 0;
        }
        int count = 0;
        if (containsKeyword(content)) {
            count++;
        }
        if (isShortLabel(content)) {
            count++;
        }
        if (hasCapitalizedWord(content)) {
            count++;
        }
        return count;
    }

    private static boolean containsKeyword(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        for (String keyword : HEADER_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isShortLabel(String content) {
        int length = content.codePointCount(0, content.length());
        return length > MIN_LABEL_LENGTH && length < MAX_LABEL_LENGTH
                && !LONG_DIGIT_RUN.matcher(content).find();
    }

    private static boolean hasCapitalizedWord(String content) {
        for (String word : WHITESPACE.split(content)) {
            if (!word.isEmpty() && Character.isUpperCase(word.codePointAt(0))) {
                return true;
            }
        }
        return false;
    }
}
