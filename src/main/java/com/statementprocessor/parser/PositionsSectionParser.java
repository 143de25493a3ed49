package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.OptionContract;
import com.statementprocessor.domain.model.OptionPosition;
import com.statementprocessor.domain.model.PositionRecord;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Parses the Open Positions section into {@link PositionRecord}s, or {@link OptionPosition}s when the
 * row is an option contract. Lot rows are DETAIL and skipped by the tokenizer; only Summary rows arrive.
 */
@Component
public class PositionsSectionParser extends AbstractSectionParser<PositionRecord> {

    private static final String SYMBOL = "Symbol";
    private static final String QUANTITY = "Quantity";

    @Override
    public SectionKind kind() {
        return SectionKind.POSITIONS;
    }

    @Override
    protected List<String> requiredColumns(Section section) {
        return List.of(SYMBOL, QUANTITY);
    }

    @Override
    protected PositionRecord parseRow(Section section, SectionRow row, ParseContext context) {
        String symbol = require(row, SYMBOL);
        String currency = require(row, "Currency");
        BigDecimal quantity = NumericFieldParser.parseRequired(row.get(QUANTITY), QUANTITY);
        String category = row.get("Asset Category");
        AssetClass hint = AssetClass.fromCategory(category);

        Optional<OptionContract> contract = OptionSymbolParser.parse(symbol);
        if (hint == AssetClass.OPTION && contract.isEmpty()) {
            throw new FieldParseException(
                    WarningType.FIELD_SYMBOL, SYMBOL, "Option row with unparseable symbol '" + symbol + "'");
        }

        BigDecimal multiplier = NumericFieldParser.parse(row.getAny("Mult", "Multiplier"), "Mult");
        if (multiplier == null) {
            multiplier = contract.isPresent() ? context.getOptionMultiplier() : BigDecimal.ONE;
        }

        PositionRecord.PositionRecordBuilder<?, ?> builder;
        if (contract.isPresent()) {
            OptionContract terms = contract.get();
            builder = OptionPosition.builder()
                    .underlying(terms.underlying())
                    .strike(terms.strike())
                    .expiry(terms.expiry())
                    .right(terms.right());
        } else {
            builder = PositionRecord.builder();
        }

        return builder.accountId(accountOf(row, context))
                .instrument(symbol)
                .assetCategory(category)
                .assetClass(hint)
                .currency(currency)
                .quantity(quantity)
                .multiplier(multiplier)
                .costPrice(NumericFieldParser.parse(row.get("Cost Price"), "Cost Price"))
                .costBasis(NumericFieldParser.parse(row.get("Cost Basis"), "Cost Basis"))
                .markPrice(NumericFieldParser.parse(row.getAny("Close Price", "Mark Price"), "Close Price"))
                .marketValue(NumericFieldParser.parse(row.get("Value"), "Value"))
                .asOfDate(context.getAsOfDate())
                .source(SectionKind.POSITIONS)
                .lineNumber(row.getLineNumber())
                .build();
    }
}
