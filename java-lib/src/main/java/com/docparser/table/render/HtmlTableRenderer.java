package com.docparser.table.render;

import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;

import java.util.Locale;

/**
 * HTML table with colspan/rowspan on merge anchors
 * Cells covered by a merge anchor are not written.
 */
public class HtmlTableRenderer implements TableRenderer {

    @Override
    public String render(TableData table) {
        StringBuilder html = new StringBuilder("<table>\n");

        if (table.hasTitle()) {
            html.append("  <caption>").append(escape(table.getTitle())).append("</caption>\n");
        }

        boolean bodyOpen = false;
        for (TableRow row : table.getRows()) {
            boolean headerRow = table.hasHeader() && row.isHeader();
            if (headerRow) {
                html.append("  <thead>\n");
                appendRow(html, row, "th");
                html.append("  </thead>\n");
                continue;
            }
            if (!bodyOpen) {
                html.append("  <tbody>\n");
                bodyOpen = true;
            }
            appendRow(html, row, "td");
        }
        if (bodyOpen) {
            html.append("  </tbody>\n");
        }

        return html.append("</table>").toString();
    }

    private static void appendRow(StringBuilder html, TableRow row, String tag) {
        html.append("    <tr>");
        for (TableCell cell : row.getCells()) {
            if (isCovered(cell)) {
                continue;
            }
            html.append('<').append(tag);
            if (cell.getColspan() != null) {
                html.append(" colspan=\"").append(cell.getColspan()).append('"');
            }
            if (cell.getRowspan() != null) {
                html.append(" rowspan=\"").append(cell.getRowspan()).append('"');
            }
            if (cell.getAlignment() != null) {
                html.append(" style=\"text-align: ").append(cell.getAlignment().name().toLowerCase(Locale.ROOT)).append('"');
            }
            html.append('>').append(escape(cell.getContent())).append("</").append(tag).append('>');
        }
        html.append("</tr>\n");
    }

    private static boolean isCovered(TableCell cell) {
        return cell.isMerged() && cell.getColspan() == null && cell.getRowspan() == null;
    }

    static String escape(String text) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                case '"':
                    escaped.append("&quot;");
                    break;
                case '\'':
                    escaped.append("&#39;");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }
}
