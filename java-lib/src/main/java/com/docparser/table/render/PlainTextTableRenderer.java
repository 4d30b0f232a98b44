package com.docparser.table.render;

import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Cells joined by " | ", one row per line, headers underlined with dashes
 */
public class PlainTextTableRenderer implements TableRenderer {

    private static final String SEPARATOR = " | ";
    private static final int RULE_WIDTH_PER_HEADER = 10;

    @Override
    public String render(TableData table) {
        StringBuilder result = new StringBuilder();

        List<String> headers = table.getHeaders();
        if (headers != null) {
            result.append(String.join(SEPARATOR, headers)).append('\n');
            result.append("-".repeat(headers.size() * RULE_WIDTH_PER_HEADER)).append('\n');
        }

        for (TableRow row : table.getRows()) {
            if (table.hasHeader() && row.isHeader()) {
                continue;
            }
            if (row.isEmpty()) {
                continue;
            }
            result.append(row.getCells().stream()
                    .map(TableCell::getContent)
                    .collect(Collectors.joining(SEPARATOR)));
            result.append('\n');
        }

        return result.toString().trim();
    }
}
