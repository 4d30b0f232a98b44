package com.docparser.table;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TableExtractionConfigTest {

    @Test
    void defaultsPreset() {
        TableExtractionConfig config = TableExtractionConfig.defaults();

        assertEquals(TableExtractionMode.STRUCTURED, config.getMode());
        assertTrue(config.isDetectHeaders());
        assertFalse(config.isPreserveFormatting());
        assertFalse(config.isIncludeEmptyCells());
        assertEquals(MergeCellsHandling.PRESERVE, config.getMergeCellsHandling());
        assertEquals(TableOutputFormat.PLAIN_TEXT, config.getOutputFormat());
        assertTrue(config.isBinaryDigitsAsBoolean());
    }

    @Test
    void simplePreset() {
        TableExtractionConfig config = TableExtractionConfig.simple();

        assertEquals(TableExtractionMode.SIMPLE, config.getMode());
        assertFalse(config.isDetectHeaders());
        assertFalse(config.isPreserveFormatting());
        assertEquals(MergeCellsHandling.IGNORE, config.getMergeCellsHandling());
    }

    @Test
    void fullPreset() {
        TableExtractionConfig config = TableExtractionConfig.full();

        assertEquals(TableExtractionMode.FULL, config.getMode());
        assertTrue(config.isDetectHeaders());
        assertTrue(config.isPreserveFormatting());
        assertTrue(config.isIncludeEmptyCells());
        assertEquals(TableOutputFormat.JSON, config.getOutputFormat());
    }

    @Test
    void withMethodsReturnModifiedCopies() {
        TableExtractionConfig base = TableExtractionConfig.defaults();
        TableExtractionConfig changed = base
                .withMode(TableExtractionMode.FORMATTED)
                .withHeaders(false)
                .withFormatting(true)
                .withEmptyCells(true)
                .withMergeCellsHandling(MergeCellsHandling.EXPAND)
                .withOutputFormat(TableOutputFormat.CSV)
                .withBinaryDigitsAsBoolean(false);

        assertEquals(TableExtractionMode.FORMATTED, changed.getMode());
        assertFalse(changed.isDetectHeaders());
        assertTrue(changed.isPreserveFormatting());
        assertTrue(changed.isIncludeEmptyCells());
        assertEquals(MergeCellsHandling.EXPAND, changed.getMergeCellsHandling());
        assertEquals(TableOutputFormat.CSV, changed.getOutputFormat());
        assertFalse(changed.isBinaryDigitsAsBoolean());

        assertEquals(TableExtractionMode.STRUCTURED, base.getMode());
        assertTrue(base.isDetectHeaders());
        assertEquals(MergeCellsHandling.PRESERVE, base.getMergeCellsHandling());
    }

    @Test
    void nullEnumsFallBackToDefaults() {
        TableExtractionConfig config = TableExtractionConfig.defaults()
                .withMode(null)
                .withMergeCellsHandling(null)
                .withOutputFormat(null);

        assertEquals(TableExtractionMode.STRUCTURED, config.getMode());
        assertEquals(MergeCellsHandling.PRESERVE, config.getMergeCellsHandling());
        assertEquals(TableOutputFormat.PLAIN_TEXT, config.getOutputFormat());
    }

    @Test
    void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(TableExtractionConfig.KEY_MODE, "full");
        properties.setProperty(TableExtractionConfig.KEY_DETECT_HEADERS, "false");
        properties.setProperty(TableExtractionConfig.KEY_MERGE_CELLS, " Expand ");
        properties.setProperty(TableExtractionConfig.KEY_OUTPUT_FORMAT, "plain-text");
        properties.setProperty(TableExtractionConfig.KEY_BINARY_DIGITS_AS_BOOLEAN, "false");

        TableExtractionConfig config = TableExtractionConfig.fromProperties(properties);

        assertEquals(TableExtractionMode.FULL, config.getMode());
        assertFalse(config.isDetectHeaders());
        assertEquals(MergeCellsHandling.EXPAND, config.getMergeCellsHandling());
        assertEquals(TableOutputFormat.PLAIN_TEXT, config.getOutputFormat());
        assertFalse(config.isBinaryDigitsAsBoolean());
        // not set
        assertFalse(config.isPreserveFormatting());
        assertFalse(config.isIncludeEmptyCells());
    }

    @Test
    void blankPropertiesKeepDefaults() {
        Properties properties = new Properties();
        properties.setProperty(TableExtractionConfig.KEY_MODE, "  ");
        properties.setProperty(TableExtractionConfig.KEY_DETECT_HEADERS, "");

        TableExtractionConfig config = TableExtractionConfig.fromProperties(properties);

        assertEquals(TableExtractionMode.STRUCTURED, config.getMode());
        assertTrue(config.isDetectHeaders());
    }

    @Test
    void rejectsUnknownEnumValue() {
        Properties properties = new Properties();
        properties.setProperty(TableExtractionConfig.KEY_MERGE_CELLS, "flatten");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TableExtractionConfig.fromProperties(properties));
        assertTrue(e.getMessage().contains("flatten"));
        assertTrue(e.getMessage().contains(TableExtractionConfig.KEY_MERGE_CELLS));
    }

    @Test
    void loadsClasspathResource() {
        TableExtractionConfig config = TableExtractionConfig.load();

        assertEquals(TableExtractionMode.FORMATTED, config.getMode());
        assertTrue(config.isDetectHeaders());
        assertTrue(config.isPreserveFormatting());
        assertTrue(config.isIncludeEmptyCells());
        assertEquals(MergeCellsHandling.EXPAND, config.getMergeCellsHandling());
        assertEquals(TableOutputFormat.MARKDOWN, config.getOutputFormat());
        assertTrue(config.isBinaryDigitsAsBoolean());
    }
}
