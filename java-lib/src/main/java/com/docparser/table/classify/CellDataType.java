package com.docparser.table.classify;

/**
 * Semantic type inferred from a cell's text
 */
public enum CellDataType {
    EMPTY,
    NUMBER,
    DATE,
    BOOLEAN,
    TEXT
}
