package com.docparser.table.model;

/**
 * Structural role of a table cell
 */
public enum CellType {
    HEADER,
    DATA,
    MERGED,
    EMPTY
}
