package com.statementprocessor.domain.model;

import java.util.List;

/**
 * Snapshots produced by the reconciler, the trades to append as audit detail, and every
 * reconciliation warning raised on the way.
 */
public record ReconciliationOutcome(
        List<PortfolioSnapshot> snapshots, List<TradeRecord> trades, List<ProcessingWarning> warnings) {

    public ReconciliationOutcome {
        snapshots = List.copyOf(snapshots);
        trades = List.copyOf(trades);
        warnings = List.copyOf(warnings);
    }
}
