package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.MarkToMarketRecord;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Parses the Mark-to-Market Performance Summary. Missing prior quantity means the instrument is new in
 * this period and is read as zero; missing prices stay null.
 */
@Component
public class MarkToMarketSectionParser extends AbstractSectionParser<MarkToMarketRecord> {

    private static final String SYMBOL = "Symbol";
    private static final String CURRENT_QUANTITY = "Current Quantity";
    private static final String TOTAL_PNL = "Mark-to-Market P/L Total";

    @Override
    public SectionKind kind() {
        return SectionKind.MTM_SUMMARY;
    }

    @Override
    protected List<String> requiredColumns(Section section) {
        return List.of(SYMBOL, CURRENT_QUANTITY);
    }

    @Override
    protected MarkToMarketRecord parseRow(Section section, SectionRow row, ParseContext context) {
        String symbol = require(row, SYMBOL);
        BigDecimal current = NumericFieldParser.parseRequired(row.get(CURRENT_QUANTITY), CURRENT_QUANTITY);
        BigDecimal prior = NumericFieldParser.parse(row.get("Prior Quantity"), "Prior Quantity");
        String category = row.get("Asset Category");

        return MarkToMarketRecord.builder()
                .accountId(accountOf(row, context))
                .instrument(symbol)
                .assetCategory(category)
                .assetClass(AssetClass.fromCategory(category))
                .priorQuantity(prior != null ? prior : BigDecimal.ZERO)
                .currentQuantity(current)
                .currentPrice(NumericFieldParser.parse(row.get("Current Price"), "Current Price"))
                .totalPnl(NumericFieldParser.parse(row.get(TOTAL_PNL), TOTAL_PNL))
                .lineNumber(row.getLineNumber())
                .build();
    }
}
