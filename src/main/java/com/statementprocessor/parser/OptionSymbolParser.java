package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.OptionRight;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.OptionContract;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses option contract identifiers in the two shapes found in activity statements:
 * <ul>
 *   <li>broker display form {@code UNDERLYING DDMMMYY STRIKE C|P}, e.g. {@code ASTS 07FEB25 26 C}</li>
 *   <li>OCC form {@code ROOT YYMMDD C|P STRIKE*1000}, e.g. {@code AAPL  240119C00150000}</li>
 * </ul>
 */
public final class OptionSymbolParser {

    private static final Pattern DISPLAY_FORM =
            Pattern.compile("^([A-Za-z0-9.]+)\\s+(\\d{2}[A-Za-z]{3}\\d{2})\\s+(\\d+(?:\\.\\d+)?)\\s+([CPcp])$");
    private static final Pattern OCC_FORM = Pattern.compile("^([A-Za-z0-9.]{1,6})\\s*(\\d{6})([CPcp])(\\d{8})$");
    private static final DateTimeFormatter OCC_EXPIRY = DateTimeFormatter.ofPattern("yyMMdd");
    private static final int OCC_STRIKE_DECIMALS = 3;

    private OptionSymbolParser() {}

    /** Returns the parsed contract, or empty if the symbol is not an option identifier. */
    public static Optional<OptionContract> parse(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return Optional.empty();
        }
        String text = symbol.trim();

        Matcher display = DISPLAY_FORM.matcher(text);
        if (display.matches()) {
            try {
                LocalDate expiry = DateFieldParser.parseDate(display.group(2), "expiry");
                return Optional.of(new OptionContract(
                        display.group(1).toUpperCase(),
                        expiry,
                        new BigDecimal(display.group(3)),
                        OptionRight.fromCode(display.group(4))));
            } catch (FieldParseException e) {
                return Optional.empty();
            }
        }

        Matcher occ = OCC_FORM.matcher(text);
        if (occ.matches()) {
            try {
                LocalDate expiry = LocalDate.parse(occ.group(2), OCC_EXPIRY);
                BigDecimal strike = new BigDecimal(occ.group(4)).movePointLeft(OCC_STRIKE_DECIMALS);
                return Optional.of(new OptionContract(
                        occ.group(1).toUpperCase(), expiry, strike, OptionRight.fromCode(occ.group(3))));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static boolean isOption(String symbol) {
        return parse(symbol).isPresent();
    }

    /** Parses a symbol that must be an option; used by parsers once the row says it is one. */
    public static OptionContract parseRequired(String symbol, String field) {
        return parse(symbol)
                .orElseThrow(() -> new FieldParseException(
                        WarningType.FIELD_SYMBOL,
                        field,
                        "Unparseable option symbol '" + symbol + "'"));
    }
}
