package com.docparser.table.classify;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the data type of a cell from its text
 *
 * Checks run in a fixed order and the first match wins: empty, number
 * (plain, currency, percentage, thousands separators, scientific), date
 * (numeric, ISO, month names, time of day, relative phrases), boolean, text.
 * Instances are immutable and safe to share.
 */
public class CellTypeClassifier {

    private static final CellTypeClassifier STANDARD = new CellTypeClassifier(true);

    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern PERCENTAGE = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)\\s?%");

    private static final List<String> CURRENCY_SYMBOLS = List.of(
            "$", "€", "¥", "£", "₹", "₽", "₩", "₪", "₦", "₡");

    private static final Set<String> CURRENCY_CODES = Set.of(
            "USD", "EUR", "GBP", "JPY", "CNY", "INR", "RUB", "KRW");

    private static final List<Pattern> DATE_PATTERNS = List.of(
            // MM/DD/YYYY, DD-MM-YY
            Pattern.compile("\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}"),
            // YYYY/MM/DD, YYYY-MM-DD
            Pattern.compile("\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}"),
            // ISO datetime
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}"),
            // DD.MM.YYYY
            Pattern.compile("\\d{1,2}\\.\\d{1,2}\\.\\d{2,4}"),
            Pattern.compile("\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\s+\\d{1,2}:\\d{2}(:\\d{2})?"),
            Pattern.compile("\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}\\s+\\d{1,2}:\\d{2}(:\\d{2})?"),
            // Dec 25, 2023
            Pattern.compile("(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},?\\s+\\d{2,4}",
                    Pattern.CASE_INSENSITIVE),
            // 25 Dec 2023
            Pattern.compile("\\d{1,2}\\s+(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\.?,?\\s+\\d{2,4}",
                    Pattern.CASE_INSENSITIVE),
            // 10:30, 22:30:45, 10:30 AM
            Pattern.compile("\\d{1,2}:\\d{2}(:\\d{2})?(\\s*(am|pm))?", Pattern.CASE_INSENSITIVE));

    private static final Set<String> RELATIVE_DATE_TERMS = Set.of(
            "today", "tomorrow", "yesterday", "now",
            "今天", "明天", "昨天", "现在",
            "aujourd'hui", "demain", "hier",
            "сегодня", "завтра", "вчера");

    private static final List<Pattern> RELATIVE_DATE_PATTERNS = List.of(
            Pattern.compile("\\d+\\s+(day|week|month|year)s?\\s+(ago|from now)"),
            Pattern.compile("(last|next|this|past)\\s+(week|month|year)"));

    private static final Set<String> BOOLEAN_TOKENS = Set.of(
            "true", "false", "yes", "no",
            "✓", "✗", "☑", "☐", "x", "o",
            "是", "否", "有", "無",
            "oui", "non",
            "да", "нет");

    private static final Set<String> BINARY_DIGITS = Set.of("0", "1");

    private final boolean binaryDigitsAsBoolean;

    /**
     * @param binaryDigitsAsBoolean when true, "0" and "1" are booleans rather than numbers
     */
    public CellTypeClassifier(boolean binaryDigitsAsBoolean) {
        this.binaryDigitsAsBoolean = binaryDigitsAsBoolean;
    }

    public static CellTypeClassifier standard() {
        return STANDARD;
    }

    public static CellTypeClassifier of(boolean binaryDigitsAsBoolean) {
        return binaryDigitsAsBoolean ? STANDARD : new CellTypeClassifier(false);
    }

    public boolean isBinaryDigitsAsBoolean() {
        return binaryDigitsAsBoolean;
    }

    public CellDataType classify(String text) {
        String trimmed = text != null ? text.trim() : "";

        if (trimmed.isEmpty()) {
            return CellDataType.EMPTY;
        }
        if (binaryDigitsAsBoolean && BINARY_DIGITS.contains(trimmed)) {
            return CellDataType.BOOLEAN;
        }
        if (isNumeric(trimmed)) {
            return CellDataType.NUMBER;
        }
        if (isDate(trimmed)) {
            return CellDataType.DATE;
        }
        if (isBoolean(trimmed)) {
            return CellDataType.BOOLEAN;
        }
        return CellDataType.TEXT;
    }

    public boolean isNumeric(String text) {
        String cleaned = text.trim();
        return isPlainNumber(cleaned)
                || isCurrency(cleaned)
                || isPercentage(cleaned)
                || isFormattedNumber(cleaned)
                || isScientificNotation(cleaned);
    }

    public boolean isPlainNumber(String text) {
        return FLOAT.matcher(text).matches();
    }

    /**
     * Leading or trailing currency symbol ("$1,234.56", "100€") or a currency
     * code next to an amount ("USD 100", "100 EUR")
     */
    public boolean isCurrency(String text) {
        for (String symbol : CURRENCY_SYMBOLS) {
            if (text.startsWith(symbol) || text.endsWith(symbol)) {
                String amount = stripAffix(text, symbol).trim().replace(",", "");
                if (isPlainNumber(amount)) {
                    return true;
                }
            }
        }

        String[] parts = text.trim().split("\\s+");
        if (parts.length == 2) {
            if (CURRENCY_CODES.contains(parts[0]) && isPlainNumber(parts[1].replace(",", ""))) {
                return true;
            }
            return CURRENCY_CODES.contains(parts[1]) && isPlainNumber(parts[0].replace(",", ""));
        }
        return false;
    }

    public boolean isPercentage(String text) {
        return PERCENTAGE.matcher(text).matches();
    }

    /** Numbers written with thousands separators, e.g. "1,000.50" */
    public boolean isFormattedNumber(String text) {
        return text.indexOf(',') >= 0 && isPlainNumber(text.replace(",", ""));
    }

    public boolean isScientificNotation(String text) {
        return (text.indexOf('e') >= 0 || text.indexOf('E') >= 0) && isPlainNumber(text);
    }

    public boolean isDate(String text) {
        for (Pattern pattern : DATE_PATTERNS) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }
        return isRelativeDate(text);
    }

    /**
     * "today", "2 days ago", "next month" and their translations
     */
    public boolean isRelativeDate(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        if (RELATIVE_DATE_TERMS.contains(lower)) {
            return true;
        }
        for (Pattern pattern : RELATIVE_DATE_PATTERNS) {
            if (pattern.matcher(lower).matches()) {
                return true;
            }
        }
        return false;
    }

    public boolean isBoolean(String text) {
        String lower = text.trim().toLowerCase(Locale.ROOT);
        if (BINARY_DIGITS.contains(lower)) {
            return binaryDigitsAsBoolean;
        }
        return BOOLEAN_TOKENS.contains(lower);
    }

    private static String stripAffix(String text, String affix) {
        String result = text;
        while (result.startsWith(affix)) {
            result = result.substring(affix.length());
        }
        while (result.endsWith(affix) && !result.isEmpty()) {
            result = result.substring(0, result.length() - affix.length());
        }
        return result;
    }
}
