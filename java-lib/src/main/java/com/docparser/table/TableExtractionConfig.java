package com.docparser.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;

/**
 * Immutable settings for one table extraction
 *
 * Use one of the presets and adjust it with the {@code withXxx} methods, each
 * of which returns a modified copy. {@link #fromProperties(Properties)} maps
 * the {@code table.*} keys one-to-one onto the fields.
 */
public final class TableExtractionConfig {
    private static final Logger logger = LoggerFactory.getLogger(TableExtractionConfig.class);

    public static final String RESOURCE_NAME = "table-extraction.properties";

    public static final String KEY_MODE = "table.mode";
    public static final String KEY_DETECT_HEADERS = "table.detect-headers";
    public static final String KEY_PRESERVE_FORMATTING = "table.preserve-formatting";
    public static final String KEY_INCLUDE_EMPTY_CELLS = "table.include-empty-cells";
    public static final String KEY_MERGE_CELLS = "table.merge-cells";
    public static final String KEY_OUTPUT_FORMAT = "table.output-format";
    public static final String KEY_BINARY_DIGITS_AS_BOOLEAN = "table.binary-digits-as-boolean";

    private final TableExtractionMode mode;
    private final boolean detectHeaders;
    private final boolean preserveFormatting;
    private final boolean includeEmptyCells;
    private final MergeCellsHandling mergeCellsHandling;
    private final TableOutputFormat outputFormat;
    private final boolean binaryDigitsAsBoolean;

    private TableExtractionConfig(TableExtractionMode mode, boolean detectHeaders, boolean preserveFormatting,
            boolean includeEmptyCells, MergeCellsHandling mergeCellsHandling, TableOutputFormat outputFormat,
            boolean binaryDigitsAsBoolean) {
        this.mode = mode != null ? mode : TableExtractionMode.STRUCTURED;
        this.detectHeaders = detectHeaders;
        this.preserveFormatting = preserveFormatting;
        this.includeEmptyCells = includeEmptyCells;
        this.mergeCellsHandling = mergeCellsHandling != null ? mergeCellsHandling : MergeCellsHandling.PRESERVE;
        this.outputFormat = outputFormat != null ? outputFormat : TableOutputFormat.PLAIN_TEXT;
        this.binaryDigitsAsBoolean = binaryDigitsAsBoolean;
    }

    /**
     * Structured mode, header detection on, formatting dropped, empty cells
     * dropped, merges marked, plain text output
     */
    public static TableExtractionConfig defaults() {
        return new TableExtractionConfig(TableExtractionMode.STRUCTURED, true, false, false,
                MergeCellsHandling.PRESERVE, TableOutputFormat.PLAIN_TEXT, true);
    }

    /**
     * Text only: no header detection, no merge handling
     */
    public static TableExtractionConfig simple() {
        return new TableExtractionConfig(TableExtractionMode.SIMPLE, false, false, false,
                MergeCellsHandling.IGNORE, TableOutputFormat.PLAIN_TEXT, true);
    }

    /**
     * Everything kept, JSON output
     */
    public static TableExtractionConfig full() {
        return new TableExtractionConfig(TableExtractionMode.FULL, true, true, true,
                MergeCellsHandling.PRESERVE, TableOutputFormat.JSON, true);
    }

    /**
     * Read {@value #RESOURCE_NAME} from the classpath, or fall back to
     * {@link #defaults()} when it is absent
     */
    public static TableExtractionConfig load() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TableExtractionConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", RESOURCE_NAME);
                return defaults();
            }
            Properties properties = new Properties();
            properties.load(in);
            return fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read " + RESOURCE_NAME + ": " + e.getMessage(), e);
        }
    }

    /**
     * Build a configuration from {@code table.*} properties; missing keys keep
     * the {@link #defaults()} value
     *
     * @throws IllegalArgumentException for an unknown enum value
     */
    public static TableExtractionConfig fromProperties(Properties properties) {
        TableExtractionConfig base = defaults();
        return new TableExtractionConfig(
                parseEnum(properties, KEY_MODE, TableExtractionMode.class, base.mode),
                parseBoolean(properties, KEY_DETECT_HEADERS, base.detectHeaders),
                parseBoolean(properties, KEY_PRESERVE_FORMATTING, base.preserveFormatting),
                parseBoolean(properties, KEY_INCLUDE_EMPTY_CELLS, base.includeEmptyCells),
                parseEnum(properties, KEY_MERGE_CELLS, MergeCellsHandling.class, base.mergeCellsHandling),
                parseEnum(properties, KEY_OUTPUT_FORMAT, TableOutputFormat.class, base.outputFormat),
                parseBoolean(properties, KEY_BINARY_DIGITS_AS_BOOLEAN, base.binaryDigitsAsBoolean));
    }

    private static boolean parseBoolean(Properties properties, String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private static <E extends Enum<E>> E parseEnum(Properties properties, String key, Class<E> type,
            E defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format("Invalid value '%s' for %s, expected one of %s",
                    value, key, Arrays.toString(type.getEnumConstants())), e);
        }
    }

    public TableExtractionConfig withMode(TableExtractionMode mode) {
        return new TableExtractionConfig(mode, detectHeaders, preserveFormatting, includeEmptyCells,
                mergeCellsHandling, outputFormat, binaryDigitsAsBoolean);
    }

    public TableExtractionConfig withHeaders(boolean detect) {
        return new TableExtractionConfig(mode, detect, preserveFormatting, includeEmptyCells,
                mergeCellsHandling, outputFormat, binaryDigitsAsBoolean);
    }

    public TableExtractionConfig withFormatting(boolean preserve) {
        return new TableExtractionConfig(mode, detectHeaders, preserve, includeEmptyCells,
                mergeCellsHandling, outputFormat, binaryDigitsAsBoolean);
    }

    public TableExtractionConfig withEmptyCells(boolean include) {
        return new TableExtractionConfig(mode, detectHeaders, preserveFormatting, include,
                mergeCellsHandling, outputFormat, binaryDigitsAsBoolean);
    }

    public TableExtractionConfig withMergeCellsHandling(MergeCellsHandling handling) {
        return new TableExtractionConfig(mode, detectHeaders, preserveFormatting, includeEmptyCells,
                handling, outputFormat, binaryDigitsAsBoolean);
    }

    public TableExtractionConfig withOutputFormat(TableOutputFormat format) {
        return new TableExtractionConfig(mode, detectHeaders, preserveFormatting, includeEmptyCells,
                mergeCellsHandling, format, binaryDigitsAsBoolean);
    }

    public TableExtractionConfig withBinaryDigitsAsBoolean(boolean asBoolean) {
        return new TableExtractionConfig(mode, detectHeaders, preserveFormatting, includeEmptyCells,
                mergeCellsHandling, outputFormat, asBoolean);
    }

    public TableExtractionMode getMode() {
        return mode;
    }

    public boolean isDetectHeaders() {
        return detectHeaders;
    }

    public boolean isPreserveFormatting() {
        return preserveFormatting;
    }

    public boolean isIncludeEmptyCells() {
        return includeEmptyCells;
    }

    public MergeCellsHandling getMergeCellsHandling() {
        return mergeCellsHandling;
    }

    public TableOutputFormat getOutputFormat() {
        return outputFormat;
    }

    public boolean isBinaryDigitsAsBoolean() {
        return binaryDigitsAsBoolean;
    }

    @Override
    public String toString() {
        return String.format("TableExtractionConfig{mode=%s, detectHeaders=%s, preserveFormatting=%s, "
                        + "includeEmptyCells=%s, mergeCells=%s, outputFormat=%s}",
                mode, detectHeaders, preserveFormatting, includeEmptyCells, mergeCellsHandling, outputFormat);
    }
}
