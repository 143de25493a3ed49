package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.AssetClass;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One instrument row of the Mark-to-Market Performance Summary.
 *
 * <p>For forex rows the symbol is a currency code, the quantities are cash balances and the prices are
 * exchange rates into the base currency. The period P/L and the new-in-period flag end up on the
 * snapshot's position and forex rows.
 */
@Value
@Builder
public class MarkToMarketRecord {

    String accountId;
    String instrument;
    AssetClass assetClass;
    String assetCategory;
    BigDecimal priorQuantity;
    BigDecimal currentQuantity;
    BigDecimal currentPrice;

    /** Period P/L of the instrument (position, transaction, commission and other components combined). */
    BigDecimal totalPnl;

    int lineNumber;

    public boolean isNew() {
        return priorQuantity == null || priorQuantity.signum() == 0;
    }
}
