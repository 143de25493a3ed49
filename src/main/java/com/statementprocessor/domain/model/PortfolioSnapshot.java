package com.statementprocessor.domain.model;

import com.statementprocessor.domain.vo.Money;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Reconciled per-account, per-date aggregate persisted to the historical store.
 *
 * <p>Uniquely identified by (accountId, asOfDate). Every Money total is in {@code baseCurrency};
 * instruments quoted in another currency are excluded from the totals and flagged during
 * reconciliation. Forex balances stay per currency.
 */
@Value
@Builder(toBuilder = true)
public class PortfolioSnapshot {

    String accountId;
    LocalDate asOfDate;
    LocalDate periodStart;
    String baseCurrency;

    /** Net premium retained on open short option positions. */
    Money optionsCredit;

    /** Marked value of short option positions (negative). */
    Money shortOptionMarkValue;

    /** Marked value of long option positions. */
    Money longOptionMarkValue;

    Money equityPositionValue;
    int openShortOptionCount;

    @Builder.Default
    List<ForexBalance> forexBalances = List.of();

    @Builder.Default
    List<PositionRecord> positions = List.of();

    int warningCount;

    public Money getOptionBalance() {
        return shortOptionMarkValue.add(longOptionMarkValue);
    }
}
