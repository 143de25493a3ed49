package com.statementprocessor.domain.vo;

import com.statementprocessor.exception.CurrencyMismatchException;
import java.math.BigDecimal;
import java.util.Objects;
import lombok.Value;

/**
 * Immutable monetary amount tagged with its ISO currency code.
 *
 * <p>Statements mix currencies freely, so arithmetic is only defined between amounts of the same
 * currency; adding USD to EUR throws {@link CurrencyMismatchException}. Conversion is never done here.
 */
@Value
public class Money {

    BigDecimal amount;
    String currency;

    public Money(BigDecimal amount, String currency) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static Money of(BigDecimal amount, String currency) {
        return new Money(amount, currency);
    }

    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(amount.add(other.amount), currency);
    }

    private void requireSameCurrency(Money other) {
        if (!currency.equalsIgnoreCase(other.currency)) {
            throw new CurrencyMismatchException(currency, other.currency);
        }
    }
}
