package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.BalanceSource;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * A per-currency line of the cash/forex sections. Forex Balances rows carry the closing balance;
 * Cash Report rows carry one labelled figure each ("Starting Cash", "Ending Cash", "Commissions", ...).
 */
@Value
@Builder
public class CashForexRecord {

    public static final String ENDING_CASH = "Ending Cash";
    public static final String FOREX_BALANCE = "Forex Balance";

    String accountId;
    String currency;
    String label;
    BigDecimal amount;
    BalanceSource source;
    int lineNumber;

    public boolean isClosingBalance() {
        return FOREX_BALANCE.equals(label) || ENDING_CASH.equalsIgnoreCase(label);
    }
}
