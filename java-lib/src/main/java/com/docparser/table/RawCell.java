package com.docparser.table;

import com.docparser.table.model.CellFormatting;

/**
 * Cell text as handed over by a document parser, with optional formatting
 */
public class RawCell {
    private final String text;
    private final CellFormatting formatting;

    public RawCell(String text, CellFormatting formatting) {
        this.text = text != null ? text : "";
        this.formatting = formatting;
    }

    public RawCell(String text) {
        this(text, null);
    }

    public static RawCell of(String text) {
        return new RawCell(text);
    }

    public static RawCell bold(String text) {
        return new RawCell(text, CellFormatting.bold());
    }

    public String getText() {
        return text;
    }

    /** May be null when the source carries no formatting */
    public CellFormatting getFormatting() {
        return formatting;
    }

    @Override
    public String toString() {
        return String.format("RawCell{text='%s', formatting=%s}", text, formatting);
    }
}
