package com.docparser.table.model;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Run-level formatting attached to a table cell
 * Colors are hex strings ("#RRGGBB"), font size is in points
 */
public class CellFormatting {
    private static final Map<String, String> HIGHLIGHT_COLORS = Map.ofEntries(
            Map.entry("yellow", "#FFFF00"),
            Map.entry("green", "#00FF00"),
            Map.entry("cyan", "#00FFFF"),
            Map.entry("magenta", "#FF00FF"),
            Map.entry("blue", "#0000FF"),
            Map.entry("red", "#FF0000"),
            Map.entry("darkblue", "#000080"),
            Map.entry("darkcyan", "#008080"),
            Map.entry("darkgreen", "#008000"),
            Map.entry("darkmagenta", "#800080"),
            Map.entry("darkred", "#800000"),
            Map.entry("darkyellow", "#808000"),
            Map.entry("darkgray", "#808080"),
            Map.entry("lightgray", "#C0C0C0"),
            Map.entry("black", "#000000"));

    private static final CellFormatting NONE = new CellFormatting(false, false, false, null, null, null, null);

    private final boolean bold;
    private final boolean italic;
    private final boolean underline;
    private final String backgroundColor;
    private final String textColor;
    private final Integer fontSize;
    private final String fontFamily;

    public CellFormatting(boolean bold, boolean italic, boolean underline, String backgroundColor,
            String textColor, Integer fontSize, String fontFamily) {
        this.bold = bold;
        this.italic = italic;
        this.underline = underline;
        this.backgroundColor = backgroundColor;
        this.textColor = textColor;
        this.fontSize = fontSize;
        this.fontFamily = fontFamily;
    }

    public static CellFormatting none() {
        return NONE;
    }

    public static CellFormatting bold() {
        return new CellFormatting(true, false, false, null, null, null, null);
    }

    public static CellFormatting italic() {
        return new CellFormatting(false, true, false, null, null, null, null);
    }

    public static CellFormatting of(boolean bold, boolean italic, boolean underline) {
        return new CellFormatting(bold, italic, underline, null, null, null, null);
    }

    public boolean isBold() {
        return bold;
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean isUnderline() {
        return underline;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public String getTextColor() {
        return textColor;
    }

    public Integer getFontSize() {
        return fontSize;
    }

    public String getFontFamily() {
        return fontFamily;
    }

    /**
     * True when at least one attribute is set
     */
    public boolean hasFormatting() {
        return bold || italic || underline
                || backgroundColor != null || textColor != null
                || fontSize != null || fontFamily != null;
    }

    /**
     * Combine with another formatting; flags are OR-ed, set values of the
     * overlay replace ours
     */
    public CellFormatting merge(CellFormatting overlay) {
        if (overlay == null) {
            return this;
        }
        return new CellFormatting(
                bold || overlay.bold,
                italic || overlay.italic,
                underline || overlay.underline,
                overlay.backgroundColor != null ? overlay.backgroundColor : backgroundColor,
                overlay.textColor != null ? overlay.textColor : textColor,
                overlay.fontSize != null ? overlay.fontSize : fontSize,
                overlay.fontFamily != null ? overlay.fontFamily : fontFamily);
    }

    /**
     * Wrap text in lightweight markup: **bold**, *italic*, __underline__
     */
    public String applyToText(String text) {
        String result = text != null ? text : "";
        if (result.isEmpty()) {
            return result;
        }
        if (bold) {
            result = "**" + result + "**";
        }
        if (italic) {
            result = "*" + result + "*";
        }
        if (underline) {
            result = "__" + result + "__";
        }
        return result;
    }

    /**
     * Convert a Word highlight color name to hex; unknown names are assumed
     * to already be hex digits
     */
    public static String highlightToHex(String highlight) {
        if (highlight == null || highlight.isBlank()) {
            return null;
        }
        String known = HIGHLIGHT_COLORS.get(highlight.trim().toLowerCase(Locale.ROOT));
        return known != null ? known : "#" + highlight.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellFormatting)) {
            return false;
        }
        CellFormatting that = (CellFormatting) o;
        return bold == that.bold && italic == that.italic && underline == that.underline
                && Objects.equals(backgroundColor, that.backgroundColor)
                && Objects.equals(textColor, that.textColor)
                && Objects.equals(fontSize, that.fontSize)
                && Objects.equals(fontFamily, that.fontFamily);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bold, italic, underline, backgroundColor, textColor, fontSize, fontFamily);
    }

    @Override
    public String toString() {
        return String.format("CellFormatting{bold=%s, italic=%s, underline=%s, fontSize=%s, fontFamily='%s'}",
                bold, italic, underline, fontSize, fontFamily);
    }
}
