package com.docparser.table;

/**
 * How much fidelity downstream renderers should attempt
 * Does not switch the inference passes on or off
 */
public enum TableExtractionMode {
    /** Plain text only */
    SIMPLE,
    /** Structure with basic formatting */
    STRUCTURED,
    /** Full formatting */
    FORMATTED,
    /** Everything, including metadata */
    FULL
}
