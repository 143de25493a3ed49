package com.statementprocessor.domain.enums;

public enum ProcessingStatus {
    SUCCESS,
    FAILED
}
