package com.docparser.table.render;

import com.docparser.table.TableExtractionConfig;
import com.docparser.table.TableOutputFormat;
import com.docparser.table.model.TableData;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonTableRendererTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void writesTableMetadataAndTypedCells() throws Exception {
        TableData table = RenderTestTables.employees();
        table.setTableId("table-1");

        JsonNode root = mapper.readTree(new JsonTableRenderer().render(table));

        assertEquals("table-1", root.get("tableId").asText());
        assertTrue(root.get("hasHeader").asBoolean());
        assertEquals("Department", root.get("headers").get(2).asText());
        assertEquals(0.61, root.get("headerConfidence").asDouble(), 1e-9);
        assertEquals(3, root.get("rowCount").asInt());
        assertEquals(3, root.get("columnCount").asInt());

        JsonNode header = root.get("rows").get(0);
        assertTrue(header.get("isHeader").asBoolean());
        assertEquals("HEADER", header.get("cells").get(0).get("cellType").asText());

        JsonNode age = root.get("rows").get(1).get("cells").get(1);
        assertEquals("25", age.get("content").asText());
        assertEquals("DATA", age.get("cellType").asText());
        assertEquals("NUMBER", age.get("dataType").asText());
        assertFalse(age.has("colspan"));
        assertFalse(age.has("formatting"));
    }

    @Test
    void tableWithoutHeaderHasNullHeaders() {
        JsonNode root = new JsonTableRenderer().toJson(RenderTestTables.numbers());

        assertTrue(root.get("headers").isNull());
        assertFalse(root.get("hasHeader").asBoolean());
    }

    @Test
    void mergeSpansAreWritten() {
        TableData table = RenderTestTables.extract(new String[][]{{"1001", "", "3003"}});

        JsonNode cells = new JsonTableRenderer().toJson(table).get("rows").get(0).get("cells");

        assertEquals(2, cells.get(0).get("colspan").asInt());
        assertEquals("MERGED", cells.get(1).get("cellType").asText());
        assertEquals("EMPTY", cells.get(1).get("dataType").asText());
    }

    @Test
    void classifierFollowsConfiguration() throws Exception {
        TableData table = RenderTestTables.extract(new String[][]{{"1"}});

        String strict = TableRenderers.render(table, TableExtractionConfig.full().withBinaryDigitsAsBoolean(false));
        String lenient = TableRenderers.render(table, TableExtractionConfig.full());

        assertEquals("NUMBER", mapper.readTree(strict).at("/rows/0/cells/0/dataType").asText());
        assertEquals("BOOLEAN", mapper.readTree(lenient).at("/rows/0/cells/0/dataType").asText());
    }

    @Test
    void rendererLookupCoversEveryFormat() {
        assertTrue(TableRenderers.forFormat(TableOutputFormat.JSON) instanceof JsonTableRenderer);
        assertTrue(TableRenderers.forFormat(TableOutputFormat.CSV) instanceof CsvTableRenderer);
        assertTrue(TableRenderers.forFormat(TableOutputFormat.TSV) instanceof CsvTableRenderer);
        assertTrue(TableRenderers.forFormat(TableOutputFormat.MARKDOWN) instanceof MarkdownTableRenderer);
        assertTrue(TableRenderers.forFormat(TableOutputFormat.HTML) instanceof HtmlTableRenderer);
        assertTrue(TableRenderers.forFormat(TableOutputFormat.PLAIN_TEXT) instanceof PlainTextTableRenderer);
    }
}
