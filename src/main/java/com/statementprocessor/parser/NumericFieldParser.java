package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.WarningType;
import java.math.BigDecimal;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lenient decimal parsing for statement cells.
 *
 * <p>Accepts thousands separators ({@code 1,234.50}), parenthesized negatives ({@code (250.00)}), a
 * currency code or symbol before or after the number ({@code 1,234.50 USD}, {@code $12}), the unicode
 * minus sign and non-breaking spaces. Empty cells and the placeholders {@code --}, {@code -} and
 * {@code N/A} parse as absent (null).
 */
public final class NumericFieldParser {

    private static final Set<String> ABSENT = Set.of("", "-", "--", "n/a", "na");
    private static final Pattern CURRENCY_PREFIX = Pattern.compile("^[A-Z]{3}\\s+");
    private static final Pattern CURRENCY_SUFFIX = Pattern.compile("\\s+[A-Z]{3}$");
    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("[$\u20AC\u00A3\u00A5]");

    private NumericFieldParser() {}

    /**
     * Parses an optional numeric cell.
     *
     * @return the value, or null when the cell is empty or a placeholder
     * @throws FieldParseException if the cell holds text that is not a number
     */
    public static BigDecimal parse(String raw, String field) {
        if (raw == null) {
            return null;
        }
        String text = raw.replace('\u00A0', ' ').replace('\u2212', '-').trim();
        if (ABSENT.contains(text.toLowerCase())) {
            return null;
        }

        text = CURRENCY_PREFIX.matcher(text).replaceFirst("");
        text = CURRENCY_SUFFIX.matcher(text).replaceFirst("");
        text = CURRENCY_SYMBOLS.matcher(text).replaceAll("").trim();

        boolean negative = false;
        if (text.startsWith("(") && text.endsWith(")")) {
            negative = true;
            text = text.substring(1, text.length() - 1).trim();
        }
        text = text.replace(",", "").replace(" ", "");

        try {
            BigDecimal value = new BigDecimal(text);
            return negative ? value.negate() : value;
        } catch (NumberFormatException e) {
            throw new FieldParseException(
                    WarningType.FIELD_NUMBER, field, "Unparseable number '" + raw + "' in '" + field + "'");
        }
    }

    /** Like {@link #parse} but an absent value is an error. */
    public static BigDecimal parseRequired(String raw, String field) {
        BigDecimal value = parse(raw, field);
        if (value == null) {
            throw FieldParseException.missing(field);
        }
        return value;
    }
}
