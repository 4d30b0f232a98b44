package com.docparser.table.model;

/**
 * A single cell of an extracted table
 * Content is stored trimmed; a cell is empty exactly when its content is ""
 */
public class TableCell {
    private String content;
    private String formattedContent;
    private CellType cellType;
    private Integer colspan;
    private Integer rowspan;
    private CellAlignment alignment;
    private CellFormatting formatting;

    public TableCell(String content) {
        this(content, null);
    }

    public TableCell(String content, CellFormatting formatting) {
        this.content = content != null ? content.trim() : "";
        this.formattedContent = this.content;
        this.formatting = formatting;
        this.cellType = this.content.isEmpty() ? CellType.EMPTY : CellType.DATA;
    }

    public static TableCell empty() {
        return new TableCell("");
    }

    public String getContent() {
        return content;
    }

    public String getFormattedContent() {
        return formattedContent;
    }

    public void setFormattedContent(String formattedContent) {
        this.formattedContent = formattedContent != null ? formattedContent : content;
    }

    public CellType getCellType() {
        return cellType;
    }

    public void setCellType(CellType cellType) {
        this.cellType = cellType;
    }

    /** Only set on the anchor of a horizontal merge */
    public Integer getColspan() {
        return colspan;
    }

    /** Only set on the anchor of a vertical merge */
    public Integer getRowspan() {
        return rowspan;
    }

    public CellAlignment getAlignment() {
        return alignment;
    }

    public void setAlignment(CellAlignment alignment) {
        this.alignment = alignment;
    }

    public CellFormatting getFormatting() {
        return formatting;
    }

    public void setFormatting(CellFormatting formatting) {
        this.formatting = formatting;
    }

    public boolean hasFormatting() {
        return formatting != null && formatting.hasFormatting();
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    public boolean isMerged() {
        return cellType == CellType.MERGED;
    }

    public boolean isHeader() {
        return cellType == CellType.HEADER;
    }

    public void setMerged(Integer colspan, Integer rowspan) {
        this.cellType = CellType.MERGED;
        this.colspan = colspan;
        this.rowspan = rowspan;
    }

    /**
     * Turn a merge anchor back into a plain cell of the given type
     */
    public void clearMerge(CellType newType) {
        this.colspan = null;
        this.rowspan = null;
        this.cellType = newType;
    }

    /**
     * Take over the text and formatting of another cell, dropping any span
     */
    public void fillFrom(TableCell source, CellType newType) {
        this.content = source.content;
        this.formattedContent = source.formattedContent;
        this.formatting = source.formatting;
        this.colspan = null;
        this.rowspan = null;
        this.cellType = newType;
    }

    /** Number of characters (code points) in the content */
    public int contentLength() {
        return content.codePointCount(0, content.length());
    }

    @Override
    public String toString() {
        return String.format("TableCell{content='%s', type=%s, colspan=%s, rowspan=%s}",
                content, cellType, colspan, rowspan);
    }
}
