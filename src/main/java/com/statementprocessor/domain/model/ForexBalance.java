package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.BalanceSource;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Closing cash balance for one currency, one per currency per statement. Never summed across currencies.
 */
@Value
@Builder(toBuilder = true)
public class ForexBalance {

    String accountId;
    String currency;
    BigDecimal balance;
    LocalDate asOfDate;
    BalanceSource source;

    /** Rate into the base currency as marked in the MTM summary. */
    BigDecimal exchangeRate;

    /** Period P/L of the currency row in the MTM summary. */
    BigDecimal mtmPnl;
}
