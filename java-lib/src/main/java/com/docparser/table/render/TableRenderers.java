package com.docparser.table.render;

import com.docparser.table.TableExtractionConfig;
import com.docparser.table.TableOutputFormat;
import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.TableData;

/**
 * Picks the renderer for an output format
 */
public final class TableRenderers {

    private TableRenderers() {
    }

    public static TableRenderer forFormat(TableOutputFormat format) {
        return forFormat(format, CellTypeClassifier.standard());
    }

    public static TableRenderer forFormat(TableOutputFormat format, CellTypeClassifier classifier) {
        switch (format) {
            case CSV:
                return CsvTableRenderer.csv();
            case TSV:
                return CsvTableRenderer.tsv();
            case MARKDOWN:
                return new MarkdownTableRenderer();
            case JSON:
                return new JsonTableRenderer(classifier);
            case HTML:
                return new HtmlTableRenderer();
            case PLAIN_TEXT:
            default:
                return new PlainTextTableRenderer();
        }
    }

    /**
     * Render with the output format and classifier settings of a configuration
     */
    public static String render(TableData table, TableExtractionConfig config) {
        return forFormat(config.getOutputFormat(), CellTypeClassifier.of(config.isBinaryDigitsAsBoolean()))
                .render(table);
    }
}
