package com.statementprocessor.domain.enums;

/**
 * Classification of a single statement line inside a section.
 *
 * <p>Only DATA rows are handed to section parsers. DETAIL rows are lot-level breakdowns of a DATA row,
 * TOTAL rows are aggregates the broker adds (Total, SubTotal, Base Currency Summary).
 */
public enum RowType {
    HEADER,
    DATA,
    DETAIL,
    TOTAL,
    NOTES,
    BLANK
}
