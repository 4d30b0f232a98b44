package com.docparser.table;

/**
 * Output formats understood by the table renderers
 */
public enum TableOutputFormat {
    PLAIN_TEXT,
    CSV,
    TSV,
    MARKDOWN,
    JSON,
    HTML
}
