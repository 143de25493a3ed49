package com.statementprocessor.domain.enums;

/**
 * What a trade did to the position. ASSIGNMENT, EXPIRATION and EXERCISE come from the
 * broker's trade codes (A, Ep, Ex); otherwise the sign of the quantity decides BUY or SELL.
 */
public enum TradeAction {
    BUY,
    SELL,
    ASSIGNMENT,
    EXPIRATION,
    EXERCISE
}
