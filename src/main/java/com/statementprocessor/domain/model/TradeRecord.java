package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * One executed trade from the Trades section.
 *
 * <p>Quantity is signed as on the statement (negative = sold). Proceeds are signed cash flow in the
 * trade currency: positive when premium or sale value was received, negative when paid. Commission is
 * negative when charged. {@code assetClass} is the hint from the Asset Category column and may be null;
 * the reconciler makes the final classification.
 */
@Value
@Builder(toBuilder = true)
public class TradeRecord {

    String accountId;
    String instrument;
    AssetClass assetClass;
    String assetCategory;
    TradeAction action;
    BigDecimal quantity;
    BigDecimal price;
    String currency;
    LocalDate tradeDate;
    LocalDateTime executedAt;
    BigDecimal proceeds;
    BigDecimal commission;
    BigDecimal realizedPnl;

    /** Raw broker trade codes, e.g. "O", "C;P", "A;C". */
    String codes;

    int lineNumber;

    public boolean isClosing() {
        return hasCode("C") || action == TradeAction.EXPIRATION || action == TradeAction.ASSIGNMENT;
    }

    public boolean isOpening() {
        return hasCode("O");
    }

    private boolean hasCode(String code) {
        if (codes == null) {
            return false;
        }
        for (String part : codes.split(";")) {
            if (part.trim().equals(code)) {
                return true;
            }
        }
        return false;
    }
}
