package com.statementprocessor.domain.enums;

/**
 * Recoverable anomalies collected into the processing summary.
 *
 * <p>FIELD_* values come from section parsers (one per skipped line). The remaining values are
 * reconciliation warnings raised while merging sections into a snapshot.
 */
public enum WarningType {
    FIELD_MISSING,
    FIELD_NUMBER,
    FIELD_DATE,
    FIELD_SYMBOL,
    SECTION_UNPARSEABLE,
    UNCLASSIFIED_INSTRUMENT,
    CLASSIFICATION_CONFLICT,
    QUANTITY_MISMATCH,
    TRADE_WITHOUT_POSITION,
    CURRENCY_MISMATCH,
    FOREX_DISCREPANCY,
    FOREX_SOURCE_CONFLICT,
    MISSING_FOREX_BALANCES;

    public boolean isFieldWarning() {
        return this == FIELD_MISSING
                || this == FIELD_NUMBER
                || this == FIELD_DATE
                || this == FIELD_SYMBOL
                || this == SECTION_UNPARSEABLE;
    }
}
