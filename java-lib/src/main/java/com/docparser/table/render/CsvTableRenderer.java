package com.docparser.table.render;

import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Delimiter-separated output through Commons CSV, one record per row
 */
public class CsvTableRenderer implements TableRenderer {

    public static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();

    public static final CSVFormat TSV_FORMAT = CSVFormat.TDF.builder()
            .setRecordSeparator('\n')
            .build();

    private final CSVFormat format;

    public CsvTableRenderer(CSVFormat format) {
        this.format = format;
    }

    public static CsvTableRenderer csv() {
        return new CsvTableRenderer(CSV_FORMAT);
    }

    public static CsvTableRenderer tsv() {
        return new CsvTableRenderer(TSV_FORMAT);
    }

    public CSVFormat getFormat() {
        return format;
    }

    @Override
    public String render(TableData table) {
        StringBuilder out = new StringBuilder();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (TableRow row : table.getRows()) {
                List<String> values = new ArrayList<>(row.cellCount());
                for (TableCell cell : row.getCells()) {
                    values.add(cell.getContent());
                }
                printer.printRecord(values);
            }
            printer.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write delimited table: " + e.getMessage(), e);
        }
        return out.toString();
    }
}
