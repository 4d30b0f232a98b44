package com.docparser.table;

/**
 * What to do with cells that appear to belong to a merged range
 */
public enum MergeCellsHandling {
    /** Leave cells untouched */
    IGNORE,
    /** Mark merged ranges, keep content */
    PRESERVE,
    /** Mark merged ranges and copy the anchor content into every covered cell */
    EXPAND
}
