package com.docparser.table.render;

import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;

import java.util.ArrayList;
import java.util.List;

/**
 * GitHub-flavoured Markdown table
 *
 * Tables without a detected header get generated "Column N" labels, since
 * Markdown requires a header line. Short rows are padded to the column count.
 */
public class MarkdownTableRenderer implements TableRenderer {

    @Override
    public String render(TableData table) {
        int columns = table.getColumnCount();
        if (columns == 0) {
            return "";
        }

        StringBuilder result = new StringBuilder();
        appendLine(result, headerLabels(table, columns));

        List<String> rule = new ArrayList<>(columns);
        for (int i = 0; i < columns; i++) {
            rule.add("---");
        }
        appendLine(result, rule);

        for (TableRow row : table.getRows()) {
            if (table.hasHeader() && row.isHeader()) {
                continue;
            }
            List<String> values = new ArrayList<>(columns);
            for (int i = 0; i < columns; i++) {
                TableCell cell = row.getCell(i);
                values.add(cell != null ? escape(cell.getFormattedContent()) : "");
            }
            appendLine(result, values);
        }

        return result.toString();
    }

    private static List<String> headerLabels(TableData table, int columns) {
        List<String> labels = new ArrayList<>(columns);
        List<String> headers = table.hasHeader() ? table.getHeaders() : null;
        for (int i = 0; i < columns; i++) {
            if (headers == null) {
                labels.add("Column " + (i + 1));
            } else {
                labels.add(i < headers.size() ? escape(headers.get(i)) : "");
            }
        }
        return labels;
    }

    private static void appendLine(StringBuilder result, List<String> values) {
        result.append("| ").append(String.join(" | ", values)).append(" |\n");
    }

    private static String escape(String text) {
        return text.replace("|", "\\|").replace("\r\n", "<br>").replace("\n", "<br>");
    }
}
