package com.statementprocessor.domain.enums;

/**
 * Why a statement run failed. STRUCTURAL runs need manual review of the document;
 * PERSISTENCE runs were rolled back and can be retried as-is.
 */
public enum FailureType {
    STRUCTURAL,
    PERSISTENCE
}
