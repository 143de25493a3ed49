package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.enums.TradeAction;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import com.statementprocessor.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Parses the Trades section. One record per order row; closed-lot breakdown rows are DETAIL and never
 * reach this parser.
 */
@Component
public class TradesSectionParser extends AbstractSectionParser<TradeRecord> {

    static final String SYMBOL = "Symbol";
    static final String QUANTITY = "Quantity";
    static final String DATE_TIME = "Date/Time";

    @Override
    public SectionKind kind() {
        return SectionKind.TRADES;
    }

    @Override
    protected List<String> requiredColumns(Section section) {
        return List.of(SYMBOL, QUANTITY, DATE_TIME);
    }

    @Override
    protected TradeRecord parseRow(Section section, SectionRow row, ParseContext context) {
        String symbol = require(row, SYMBOL);
        String currency = require(row, "Currency");
        LocalDateTime executedAt = DateFieldParser.parseDateTime(require(row, DATE_TIME), DATE_TIME);
        BigDecimal quantity = NumericFieldParser.parseRequired(row.get(QUANTITY), QUANTITY);
        String category = row.get("Asset Category");
        String codes = row.get("Code");

        return TradeRecord.builder()
                .accountId(accountOf(row, context))
                .instrument(symbol)
                .assetCategory(category)
                .assetClass(AssetClass.fromCategory(category))
                .action(actionOf(codes, quantity))
                .quantity(quantity)
                .price(NumericFieldParser.parse(row.getAny("T. Price", "TradePrice", "Price"), "T. Price"))
                .currency(currency)
                .tradeDate(executedAt.toLocalDate())
                .executedAt(executedAt)
                .proceeds(NumericFieldParser.parse(row.get("Proceeds"), "Proceeds"))
                .commission(NumericFieldParser.parse(row.getAny("Comm/Fee", "Comm in USD", "Commission"), "Comm/Fee"))
                .realizedPnl(NumericFieldParser.parse(row.get("Realized P/L"), "Realized P/L"))
                .codes(codes)
                .lineNumber(row.getLineNumber())
                .build();
    }

    static TradeAction actionOf(String codes, BigDecimal quantity) {
        if (codes != null) {
            for (String code : codes.split(";")) {
                switch (code.trim()) {
                    case "A":
                        return TradeAction.ASSIGNMENT;
                    case "Ep":
                        return TradeAction.EXPIRATION;
                    case "Ex":
                        return TradeAction.EXERCISE;
                    default:
                        break;
                }
            }
        }
        return quantity.signum() < 0 ? TradeAction.SELL : TradeAction.BUY;
    }
}
