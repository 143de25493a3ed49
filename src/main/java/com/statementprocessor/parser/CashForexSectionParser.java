package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.BalanceSource;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.CashForexRecord;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Parses both cash sections.
 *
 * <p>Forex Balances: the Description column is the currency held and Quantity is its closing balance
 * (the Currency column there is the reporting currency). Cash Report: one record per labelled line per
 * currency, amount from the Total column.
 */
@Component
public class CashForexSectionParser extends AbstractSectionParser<CashForexRecord> {

    private static final String DESCRIPTION = "Description";
    private static final String QUANTITY = "Quantity";
    private static final String SUMMARY_LABEL = "Currency Summary";
    private static final String TOTAL = "Total";

    @Override
    public SectionKind kind() {
        return SectionKind.CASH_FOREX;
    }

    @Override
    protected List<String> requiredColumns(Section section) {
        return sourceOf(section) == BalanceSource.FOREX_BALANCES
                ? List.of(DESCRIPTION, QUANTITY)
                : List.of(SUMMARY_LABEL, "Currency", TOTAL);
    }

    @Override
    protected CashForexRecord parseRow(Section section, SectionRow row, ParseContext context) {
        if (sourceOf(section) == BalanceSource.FOREX_BALANCES) {
            return CashForexRecord.builder()
                    .accountId(accountOf(row, context))
                    .currency(require(row, DESCRIPTION).toUpperCase())
                    .label(CashForexRecord.FOREX_BALANCE)
                    .amount(NumericFieldParser.parseRequired(row.get(QUANTITY), QUANTITY))
                    .source(BalanceSource.FOREX_BALANCES)
                    .lineNumber(row.getLineNumber())
                    .build();
        }
        BigDecimal amount = NumericFieldParser.parseRequired(row.get(TOTAL), TOTAL);
        return CashForexRecord.builder()
                .accountId(accountOf(row, context))
                .currency(require(row, "Currency").toUpperCase())
                .label(require(row, SUMMARY_LABEL))
                .amount(amount)
                .source(BalanceSource.CASH_REPORT)
                .lineNumber(row.getLineNumber())
                .build();
    }

    static BalanceSource sourceOf(Section section) {
        String name = section.getName() != null ? section.getName().trim() : "";
        return name.equalsIgnoreCase("Forex Balances") ? BalanceSource.FOREX_BALANCES : BalanceSource.CASH_REPORT;
    }
}
