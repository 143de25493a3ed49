package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.PositionSide;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.vo.Money;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * A holding as of the statement's period end, one per instrument per account.
 *
 * <p>Quantity is signed: positive = long, negative = short. {@code source} tells whether the row came
 * from the Open Positions section or was filled in from the Mark-to-Market summary.
 */
@Getter
@SuperBuilder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class PositionRecord {

    private final String accountId;
    private final String instrument;
    private final AssetClass assetClass;
    private final String assetCategory;
    private final String currency;
    private final BigDecimal quantity;

    /** Contract multiplier; 1 for equities and forex. */
    private final BigDecimal multiplier;

    private final BigDecimal costPrice;

    /** Signed cost basis as reported: negative for short positions (premium received). */
    private final BigDecimal costBasis;

    private final BigDecimal markPrice;

    /** Reported market value, null when the source section does not carry one. */
    private final BigDecimal marketValue;

    /** Period P/L from the Mark-to-Market summary, null when the instrument has no MTM row. */
    private final BigDecimal mtmPnl;

    /** True when the MTM summary shows no prior quantity; null when the instrument has no MTM row. */
    private final Boolean newInPeriod;

    private final LocalDate asOfDate;
    private final SectionKind source;
    private final int lineNumber;

    public PositionSide getSide() {
        if (quantity == null || quantity.signum() == 0) {
            return PositionSide.FLAT;
        }
        return quantity.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    /** Reported market value if present, otherwise quantity * mark price * multiplier. */
    public Money marketValueMoney() {
        if (marketValue != null) {
            return Money.of(marketValue, currency);
        }
        if (quantity == null || markPrice == null) {
            return Money.zero(currency);
        }
        BigDecimal mult = multiplier != null ? multiplier : BigDecimal.ONE;
        return Money.of(quantity.multiply(markPrice).multiply(mult), currency);
    }
}
