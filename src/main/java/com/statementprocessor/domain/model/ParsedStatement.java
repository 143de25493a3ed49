package com.statementprocessor.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * All typed records extracted from one document, grouped by section kind, plus the field warnings.
 */
@Data
@Builder
public class ParsedStatement {

    @Builder.Default
    private List<TradeRecord> trades = new ArrayList<>();

    @Builder.Default
    private List<PositionRecord> positions = new ArrayList<>();

    @Builder.Default
    private List<MarkToMarketRecord> markToMarket = new ArrayList<>();

    @Builder.Default
    private List<CashForexRecord> cashForex = new ArrayList<>();

    @Builder.Default
    private List<StatementField> fields = new ArrayList<>();

    @Builder.Default
    private List<ProcessingWarning> warnings = new ArrayList<>();

    private int recordsParsed;
}
