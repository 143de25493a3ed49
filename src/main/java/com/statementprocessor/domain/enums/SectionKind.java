package com.statementprocessor.domain.enums;

/**
 * Reporting category of a contiguous region of a statement document.
 *
 * <p>STATEMENT_INFO and ACCOUNT_INFO carry document metadata (period, account, base currency).
 * UNKNOWN covers any region whose header did not match a tokenizer rule; those regions are
 * kept so that format drift shows up in the processing summary.
 */
public enum SectionKind {
    STATEMENT_INFO,
    ACCOUNT_INFO,
    TRADES,
    POSITIONS,
    MTM_SUMMARY,
    CASH_FOREX,
    UNKNOWN
}
