package com.statementprocessor.reconciliation;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.parser.OptionSymbolParser;
import java.util.Currency;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Classifies an instrument identifier as equity, option or forex.
 *
 * <p>The identifier's shape decides when it is unambiguous (an option contract, a currency pair such as
 * {@code EUR.USD}); the statement's Asset Category hint decides the rest. When shape and hint disagree
 * the result carries a CLASSIFICATION_CONFLICT; when neither yields a class it is UNCLASSIFIED.
 */
@Component
public class InstrumentClassifier {

    private static final Pattern CURRENCY_PAIR = Pattern.compile("^[A-Z]{3}[./][A-Z]{3}$");
    private static final Pattern TICKER = Pattern.compile("^[A-Z][A-Z0-9.\\-]{0,9}$");

    public Classification classify(String identifier, AssetClass hint) {
        if (identifier == null || identifier.isBlank()) {
            return Classification.unclassified("empty instrument identifier");
        }
        String symbol = identifier.trim();

        if (OptionSymbolParser.isOption(symbol)) {
            return resolve(AssetClass.OPTION, hint, symbol);
        }
        if (CURRENCY_PAIR.matcher(symbol).matches()) {
            return resolve(AssetClass.FOREX, hint, symbol);
        }
        if (isCurrencyCode(symbol) && hint == AssetClass.FOREX) {
            return Classification.of(AssetClass.FOREX);
        }
        if (TICKER.matcher(symbol).matches()) {
            if (hint == null || hint == AssetClass.EQUITY) {
                return Classification.of(AssetClass.EQUITY);
            }
            if (hint == AssetClass.OPTION) {
                return Classification.unclassified(
                        "'" + symbol + "' is categorized as an option but is not an option contract");
            }
            return Classification.conflict(
                    AssetClass.EQUITY, "'" + symbol + "' looks like a ticker but is categorized as " + hint);
        }

        // Shape unknown: a category other than options is trusted as is
        if (hint != null && hint != AssetClass.OPTION && hint != AssetClass.UNCLASSIFIED) {
            return Classification.of(hint);
        }
        return Classification.unclassified("cannot classify instrument '" + symbol + "'");
    }

    private static Classification resolve(AssetClass byShape, AssetClass hint, String symbol) {
        if (hint == null || hint == byShape) {
            return Classification.of(byShape);
        }
        return Classification.conflict(
                byShape, "'" + symbol + "' has the shape of " + byShape + " but is categorized as " + hint);
    }

    static boolean isCurrencyCode(String symbol) {
        if (symbol.length() != 3) {
            return false;
        }
        try {
            Currency.getInstance(symbol);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Classification result. {@code warning} is null for a clean classification.
     */
    public record Classification(AssetClass assetClass, WarningType warning, String reason) {

        static Classification of(AssetClass assetClass) {
            return new Classification(assetClass, null, null);
        }

        static Classification conflict(AssetClass assetClass, String reason) {
            return new Classification(assetClass, WarningType.CLASSIFICATION_CONFLICT, reason);
        }

        static Classification unclassified(String reason) {
            return new Classification(AssetClass.UNCLASSIFIED, WarningType.UNCLASSIFIED_INSTRUMENT, reason);
        }

        public boolean isClean() {
            return warning == null;
        }
    }
}
