package com.statementprocessor.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything one statement contributes to the historical store, written as a single unit.
 */
@Value
@Builder
public class WriteRequest {

    String documentId;

    @Builder.Default
    List<PortfolioSnapshot> snapshots = List.of();

    @Builder.Default
    List<TradeRecord> trades = List.of();
}
