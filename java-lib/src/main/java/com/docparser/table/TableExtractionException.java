package com.docparser.table;

/**
 * Raised when a table cannot be extracted at all
 * Callers are expected to substitute a stand-in and carry on with the rest
 * of the document
 */
public class TableExtractionException extends Exception {

    public TableExtractionException(String message) {
        super(message);
    }

    public TableExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
