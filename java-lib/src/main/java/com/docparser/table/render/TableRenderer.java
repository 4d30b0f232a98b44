package com.docparser.table.render;

import com.docparser.table.model.TableData;

/**
 * Writes a processed table in one output format
 * Renderers only read the table
 */
public interface TableRenderer {

    String render(TableData table);
}
