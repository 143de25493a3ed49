package com.statementprocessor.parser;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Run-level values the section parsers need but cannot read from the section itself. Rows that carry
 * their own Account column override {@code accountId}.
 */
@Value
@Builder
public class ParseContext {

    String accountId;
    String baseCurrency;
    LocalDate asOfDate;

    @Builder.Default
    BigDecimal optionMultiplier = new BigDecimal("100");

    public static ParseContext empty() {
        return ParseContext.builder().build();
    }
}
