package com.statementprocessor.domain.enums;

/**
 * Where a per-currency cash balance was read from, in order of preference.
 */
public enum BalanceSource {
    FOREX_BALANCES,
    CASH_REPORT,
    MTM_SUMMARY
}
