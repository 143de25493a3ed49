package com.statementprocessor.domain.enums;

/**
 * Derived from the signed position quantity: positive = LONG, negative = SHORT.
 */
public enum PositionSide {
    LONG,
    SHORT,
    FLAT
}
