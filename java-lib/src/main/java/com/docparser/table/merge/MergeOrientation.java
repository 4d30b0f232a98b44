package com.docparser.table.merge;

/**
 * Axis along which a merged range extends
 */
enum MergeOrientation {
    HORIZONTAL,
    VERTICAL
}
