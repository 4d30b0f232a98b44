package com.docparser.table.source;

import com.docparser.table.RawCell;
import com.docparser.table.TableExtractionConfig;
import com.docparser.table.TableExtractionException;
import com.docparser.table.TableExtractor;
import com.docparser.table.model.TableData;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.XHTMLContentHandler;
import org.junit.jupiter.api.Test;
import org.xml.sax.ContentHandler;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTableReaderTest {

    private static final String REPORT = "<html><head><title>Report</title></head><body>"
            + "<p>Quarterly figures</p>"
            + "<table>"
            + "<tr><th>Product</th><th>Price</th></tr>"
            + "<tr><td>Widget</td><td>9.99</td></tr>"
            + "<tr><td>Gadget</td><td>19.99</td></tr>"
            + "</table>"
            + "<table>"
            + "<tr><td>Region</td><td>North</td></tr>"
            + "<tr><td></td><td>South</td></tr>"
            + "</table>"
            + "</body></html>";

    @Test
    void readsTablesFromHtmlDocument() throws IOException {
        DocumentTableReader reader = new DocumentTableReader();

        DocumentTablesResult result = reader.readTables(
                REPORT.getBytes(StandardCharsets.UTF_8), "report.html", TableExtractionConfig.full());

        assertEquals("report.html", result.getFileName());
        assertTrue(result.getContentType().startsWith("text/html"), result.getContentType());
        assertEquals(0, result.getFailedTableCount());

        List<TableData> tables = result.getTables();
        assertEquals(2, tables.size());

        TableData prices = tables.get(0);
        assertEquals("table-1", prices.getTableId());
        assertTrue(prices.hasHeader());
        assertEquals(List.of("Product", "Price"), prices.getHeaders());
        assertEquals("19.99", prices.getCell(2, 1).getContent());

        TableData regions = tables.get(1);
        assertEquals("table-2", regions.getTableId());
        assertEquals(2, regions.getRowCount());
    }

    @Test
    void usesGivenParser() throws IOException {
        DocumentTableReader reader = new DocumentTableReader(new TableEmittingParser(), new TableExtractor());

        DocumentTablesResult result = reader.readTables(new byte[]{1}, "sheet.xlsx", TableExtractionConfig.defaults());

        assertEquals(1, result.getTables().size());
        TableData table = result.getTables().get(0);
        assertEquals("Name", table.getCell(0, 0).getContent());
        assertTrue(table.hasHeader());
    }

    @Test
    void failingTableIsReplacedByStandIn() throws IOException {
        TableExtractor failing = new TableExtractor() {
            @Override
            public TableData extract(List<? extends List<RawCell>> grid, TableExtractionConfig config)
                    throws TableExtractionException {
                throw new TableExtractionException("cannot traverse table");
            }
        };
        DocumentTableReader reader = new DocumentTableReader(new TableEmittingParser(), failing);

        DocumentTablesResult result = reader.readTables(new byte[]{1}, "sheet.xlsx", TableExtractionConfig.defaults());

        assertEquals(1, result.getFailedTableCount());
        TableData standIn = result.getTables().get(0);
        assertEquals("[Table with 3 rows]", standIn.getTitle());
        assertEquals("table-1", standIn.getTableId());
        assertTrue(standIn.isEmpty());
    }

    @Test
    void parseFailureNamesTheFile() {
        DocumentTableReader reader = new DocumentTableReader(new BrokenParser(), new TableExtractor());

        IOException e = assertThrows(IOException.class,
                () -> reader.readTables(new byte[]{1}, "broken.docx", TableExtractionConfig.defaults()));
        assertTrue(e.getMessage().contains("broken.docx"));
        assertTrue(e.getCause() instanceof TikaException);
    }

    @Test
    void emptyContentIsRejected() {
        DocumentTableReader reader = new DocumentTableReader(new TableEmittingParser(), new TableExtractor());

        IOException e = assertThrows(IOException.class,
                () -> reader.readTables(new byte[0], " ", TableExtractionConfig.defaults()));
        assertTrue(e.getMessage().contains("unknown_document"));
        assertThrows(IOException.class, () -> reader.readTables(null, "a.docx", TableExtractionConfig.defaults()));
    }

    @Test
    void documentWithoutTablesGivesEmptyResult() throws IOException {
        DocumentTableReader reader = new DocumentTableReader();

        DocumentTablesResult result = reader.readTables(
                "just some text".getBytes(StandardCharsets.UTF_8), "notes.txt", TableExtractionConfig.defaults());

        assertTrue(result.getTables().isEmpty());
        assertEquals(0, result.getFailedTableCount());
    }

    @Test
    void supportedFormats() {
        assertTrue(DocumentTableReader.isSupportedFormat("report.DOCX"));
        assertTrue(DocumentTableReader.isSupportedFormat("archive.v2.pdf"));
        assertFalse(DocumentTableReader.isSupportedFormat("image.png"));
        assertFalse(DocumentTableReader.isSupportedFormat("README"));
        assertFalse(DocumentTableReader.isSupportedFormat(null));
        assertTrue(DocumentTableReader.getSupportedExtensions().contains("odt"));
    }

    private static final class TableEmittingParser implements Parser {
        @Override
        public Set<MediaType> getSupportedTypes(ParseContext context) {
            return Set.of(MediaType.application("octet-stream"));
        }

        @Override
        public void parse(InputStream stream, ContentHandler handler, Metadata metadata, ParseContext context)
                throws IOException, SAXException, TikaException {
            metadata.set(Metadata.CONTENT_TYPE, "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
            XHTMLContentHandler xhtml = new XHTMLContentHandler(handler, metadata);
            xhtml.startDocument();
            xhtml.startElement("table");
            row(xhtml, "Name", "Age", "Department");
            row(xhtml, "John", "25", "Eng");
            row(xhtml, "Jane", "30", "Mkt");
            xhtml.endElement("table");
            xhtml.endDocument();
        }

        private static void row(XHTMLContentHandler xhtml, String... values) throws SAXException {
            xhtml.startElement("tr");
            for (String value : values) {
                xhtml.element("td", value);
            }
            xhtml.endElement("tr");
        }
    }

    private static final class BrokenParser implements Parser {
        @Override
        public Set<MediaType> getSupportedTypes(ParseContext context) {
            return Set.of(MediaType.application("octet-stream"));
        }

        @Override
        public void parse(InputStream stream, ContentHandler handler, Metadata metadata, ParseContext context)
                throws TikaException {
            throw new TikaException("Unexpected end of archive");
        }
    }
}
