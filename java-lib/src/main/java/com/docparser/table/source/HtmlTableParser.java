package com.docparser.table.source;

import com.docparser.table.RawCell;
import com.docparser.table.model.CellFormatting;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lifts the tables of an (X)HTML rendering into raw cell grids
 *
 * Works on the markup Tika produces for office documents: one {@code <table>}
 * per document table, {@code <p>} per paragraph inside a cell, and inline
 * {@code <b>/<i>/<u>} runs. Header cells ({@code <th>}) are reported bold.
 * A table nested inside a cell is not a table of its own; its text becomes
 * part of the enclosing cell.
 */
public class HtmlTableParser {

    private static final Set<String> ROW_GROUPS = Set.of("thead", "tbody", "tfoot");

    private static final Set<String> LINE_ELEMENTS = Set.of("br", "p", "div", "li", "table", "tr");

    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");

    /**
     * Every outermost table in the document, in document order
     */
    public List<List<List<RawCell>>> parseTables(String html) {
        List<List<List<RawCell>>> tables = new ArrayList<>();
        if (html == null || html.isEmpty()) {
            return tables;
        }

        Document document = Jsoup.parse(html);
        for (Element table : document.select("table")) {
            if (table.parents().is("table")) {
                continue;
            }
            List<List<RawCell>> grid = parseTable(table);
            if (!grid.isEmpty()) {
                tables.add(grid);
            }
        }
        return tables;
    }

    /**
     * Rows of one table element; rows of nested tables are not included
     */
    List<List<RawCell>> parseTable(Element table) {
        List<List<RawCell>> rows = new ArrayList<>();
        for (Element row : directRows(table)) {
            List<RawCell> cells = parseRow(row);
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return rows;
    }

    private static List<Element> directRows(Element table) {
        List<Element> rows = new ArrayList<>();
        for (Element child : table.children()) {
            if (isTag(child, "tr")) {
                rows.add(child);
            } else if (ROW_GROUPS.contains(child.normalName())) {
                for (Element groupChild : child.children()) {
                    if (isTag(groupChild, "tr")) {
                        rows.add(groupChild);
                    }
                }
            }
        }
        return rows;
    }

    private List<RawCell> parseRow(Element row) {
        List<RawCell> cells = new ArrayList<>();
        for (Element cell : row.children()) {
            boolean headerCell = isTag(cell, "th");
            if (!headerCell && !isTag(cell, "td")) {
                continue;
            }

            CellFormatting formatting = CellFormatting.of(
                    headerCell || !cell.select("b, strong").isEmpty(),
                    !cell.select("i, em").isEmpty(),
                    !cell.select("u").isEmpty());

            cells.add(new RawCell(toText(cell), formatting.hasFormatting() ? formatting : null));
        }
        return cells;
    }

    /**
     * Cell text with one line per paragraph; nested cells are separated by spaces
     */
    static String toText(Element cell) {
        StringBuilder raw = new StringBuilder();
        cell.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                raw.append(((TextNode) node).getWholeText());
            } else if (node instanceof Element && node != cell) {
                Element element = (Element) node;
                if (LINE_ELEMENTS.contains(element.normalName())) {
                    raw.append('\n');
                } else if (isTag(element, "td") || isTag(element, "th")) {
                    raw.append(' ');
                }
            }
        });

        StringBuilder result = new StringBuilder();
        for (String line : raw.toString().split("\\r?\\n")) {
            String cleaned = HORIZONTAL_SPACE.matcher(line).replaceAll(" ").trim();
            if (!cleaned.isEmpty()) {
                if (result.length() > 0) {
                    result.append('\n');
                }
                result.append(cleaned);
            }
        }
        return result.toString();
    }

    private static boolean isTag(Element element, String name) {
        return element.normalName().equals(name);
    }
}
