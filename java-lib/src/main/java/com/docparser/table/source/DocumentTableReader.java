package com.docparser.table.source;

import com.docparser.table.RawCell;
import com.docparser.table.TableExtractionConfig;
import com.docparser.table.TableExtractionException;
import com.docparser.table.TableExtractor;
import com.docparser.table.model.TableData;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.parser.Parser;
import org.apache.tika.sax.ToHTMLContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the tables of a document using Apache Tika
 *
 * Tika renders the document as XHTML; every table in it is turned into a raw
 * cell grid and run through the {@link TableExtractor}. Container formats are
 * handled entirely by Tika.
 *
 * A document that cannot be parsed fails the whole call. A single table that
 * cannot be extracted is replaced by a "[Table with N rows]" stand-in so the
 * rest of the document still comes through.
 */
public class DocumentTableReader {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTableReader.class);

    private static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "txt", "rtf", "odt", "ods", "odp", "html", "htm");

    private final Parser parser;
    private final TableExtractor extractor;
    private final HtmlTableParser htmlTableParser;

    public DocumentTableReader() {
        this(new AutoDetectParser(), new TableExtractor());
    }

    public DocumentTableReader(Parser parser, TableExtractor extractor) {
        this.parser = parser;
        this.extractor = extractor;
        this.htmlTableParser = new HtmlTableParser();
    }

    /**
     * Extract and process every table in a document
     *
     * @param documentContent the document bytes
     * @param fileName        original file name, used for type detection
     * @param config          extraction settings applied to every table
     * @throws IOException if the document is empty or cannot be parsed
     */
    public DocumentTablesResult readTables(byte[] documentContent, String fileName, TableExtractionConfig config)
            throws IOException {
        if (fileName == null || fileName.trim().isEmpty()) {
            fileName = "unknown_document";
        }
        if (documentContent == null || documentContent.length == 0) {
            throw new IOException("Document processing failed: content is null or empty for file: " + fileName);
        }

        logger.info("Starting table extraction for: {}", fileName);

        Metadata metadata = new Metadata();
        String html = toHtml(documentContent, fileName, metadata);
        String contentType = metadata.get(Metadata.CONTENT_TYPE);

        List<List<List<RawCell>>> grids = htmlTableParser.parseTables(html);
        List<TableData> tables = new ArrayList<>(grids.size());
        int failed = 0;

        for (int i = 0; i < grids.size(); i++) {
            List<List<RawCell>> grid = grids.get(i);
            TableData table;
            try {
                table = extractor.extract(grid, config);
                table.setTableId(String.format("table-%d", i + 1));
            } catch (TableExtractionException e) {
                logger.warn("Table {} of {} could not be extracted, using a stand-in: {}",
                        i + 1, fileName, e.getMessage());
                table = TableData.placeholder(grid.size());
                table.setTableId(String.format("table-%d", i + 1));
                failed++;
            }
            tables.add(table);
        }

        logger.info("Extraction completed for {} - content type: {}, tables: {}, failed: {}",
                fileName, contentType, tables.size(), failed);

        return new DocumentTablesResult(fileName, contentType, tables, failed);
    }

    private String toHtml(byte[] documentContent, String fileName, Metadata metadata) throws IOException {
        metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);

        ParseContext parseContext = new ParseContext();
        parseContext.set(Parser.class, parser);
        ToHTMLContentHandler handler = new ToHTMLContentHandler();

        try (InputStream inputStream = new ByteArrayInputStream(documentContent)) {
            parser.parse(inputStream, handler, metadata, parseContext);
        } catch (Exception e) {
            throw new IOException(
                    String.format("Document processing failed for file '%s': %s. "
                                    + "The document may be corrupted, password-protected, or in an unsupported format.",
                            fileName, e.getMessage()),
                    e);
        }
        return handler.toString();
    }

    /**
     * Check if the file name has an extension Tika is expected to handle
     */
    public static boolean isSupportedFormat(String fileName) {
        return SUPPORTED_EXTENSIONS.contains(getFileExtension(fileName).toLowerCase(Locale.ROOT));
    }

    public static Set<String> getSupportedExtensions() {
        return SUPPORTED_EXTENSIONS;
    }

    private static String getFileExtension(String fileName) {
        if (fileName == null || !fileName.contains(".")) {
            return "";
        }
        return fileName.substring(fileName.lastIndexOf('.') + 1);
    }
}
