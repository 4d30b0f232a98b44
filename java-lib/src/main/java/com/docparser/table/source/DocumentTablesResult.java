package com.docparser.table.source;

import com.docparser.table.model.TableData;

import java.util.List;

/**
 * Tables read from one document
 */
public class DocumentTablesResult {
    private final String fileName;
    private final String contentType;
    private final List<TableData> tables;
    private final int failedTableCount;

    public DocumentTablesResult(String fileName, String contentType, List<TableData> tables, int failedTableCount) {
        this.fileName = fileName != null ? fileName : "";
        this.contentType = contentType != null ? contentType : "application/octet-stream";
        this.tables = tables != null ? List.copyOf(tables) : List.of();
        this.failedTableCount = Math.max(0, failedTableCount);
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }

    public List<TableData> getTables() {
        return tables;
    }

    /** Tables replaced by a "[Table with N rows]" stand-in */
    public int getFailedTableCount() {
        return failedTableCount;
    }

    public boolean hasTables() {
        return !tables.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("DocumentTablesResult{file='%s', contentType='%s', tables=%d, failed=%d}",
                fileName, contentType, tables.size(), failedTableCount);
    }
}
