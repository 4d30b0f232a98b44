package com.docparser.table.render;

import com.docparser.table.classify.CellTypeClassifier;
import com.docparser.table.model.CellFormatting;
import com.docparser.table.model.TableCell;
import com.docparser.table.model.TableData;
import com.docparser.table.model.TableRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Structured JSON: table metadata, rows and cells with their inferred types
 */
public class JsonTableRenderer implements TableRenderer {

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final CellTypeClassifier classifier;

    public JsonTableRenderer() {
        this(CellTypeClassifier.standard());
    }

    public JsonTableRenderer(CellTypeClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public String render(TableData table) {
        try {
            return mapper.writeValueAsString(toJson(table));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize table to JSON: " + e.getMessage(), e);
        }
    }

    public ObjectNode toJson(TableData table) {
        ObjectNode root = mapper.createObjectNode();
        root.put("title", table.getTitle());
        root.put("tableId", table.getTableId());
        root.put("hasHeader", table.hasHeader());

        if (table.getHeaders() != null) {
            ArrayNode headers = root.putArray("headers");
            table.getHeaders().forEach(headers::add);
        } else {
            root.putNull("headers");
        }
        if (table.getHeaderConfidence() != null) {
            root.put("headerConfidence", table.getHeaderConfidence());
        }
        root.put("rowCount", table.getRowCount());
        root.put("columnCount", table.getColumnCount());

        ArrayNode rows = root.putArray("rows");
        for (TableRow row : table.getRows()) {
            ObjectNode rowNode = rows.addObject();
            rowNode.put("rowIndex", row.getRowIndex());
            rowNode.put("isHeader", row.isHeader());
            ArrayNode cells = rowNode.putArray("cells");
            for (TableCell cell : row.getCells()) {
                cells.add(cellToJson(cell));
            }
        }
        return root;
    }

    private ObjectNode cellToJson(TableCell cell) {
        ObjectNode node = mapper.createObjectNode();
        node.put("content", cell.getContent());
        node.put("formattedContent", cell.getFormattedContent());
        node.put("cellType", cell.getCellType().name());
        node.put("dataType", classifier.classify(cell.getContent()).name());
        if (cell.getColspan() != null) {
            node.put("colspan", cell.getColspan());
        }
        if (cell.getRowspan() != null) {
            node.put("rowspan", cell.getRowspan());
        }
        if (cell.getAlignment() != null) {
            node.put("alignment", cell.getAlignment().name());
        }
        if (cell.hasFormatting()) {
            node.set("formatting", formattingToJson(cell.getFormatting()));
        }
        return node;
    }

    private static ObjectNode formattingToJson(CellFormatting formatting) {
        ObjectNode node = mapper.createObjectNode();
        node.put("bold", formatting.isBold());
        node.put("italic", formatting.isItalic());
        node.put("underline", formatting.isUnderline());
        if (formatting.getBackgroundColor() != null) {
            node.put("backgroundColor", formatting.getBackgroundColor());
        }
        if (formatting.getTextColor() != null) {
            node.put("textColor", formatting.getTextColor());
        }
        if (formatting.getFontSize() != null) {
            node.put("fontSize", formatting.getFontSize());
        }
        if (formatting.getFontFamily() != null) {
            node.put("fontFamily", formatting.getFontFamily());
        }
        return node;
    }
}
