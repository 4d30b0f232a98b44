package com.docparser.table.model;

/**
 * Horizontal text alignment of a cell, when the source reports one
 */
public enum CellAlignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY
}
