package com.statementprocessor.exception;

import java.util.Map;

/**
 * Raised by {@link com.statementprocessor.domain.vo.Money} when amounts of two different
 * currencies are combined. Indicates a programming error, not bad input.
 */
public class CurrencyMismatchException extends BaseException {

    public CurrencyMismatchException(String left, String right) {
        super(
                ErrorCode.CURRENCY_MISMATCH,
                null,
                String.format("Cannot combine amounts in %s and %s", left, right),
                Map.of("left", left, "right", right),
                null);
    }
}
