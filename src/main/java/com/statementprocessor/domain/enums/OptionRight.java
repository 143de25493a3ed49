package com.statementprocessor.domain.enums;

public enum OptionRight {
    CALL,
    PUT;

    public static OptionRight fromCode(String code) {
        if ("C".equalsIgnoreCase(code)) {
            return CALL;
        }
        if ("P".equalsIgnoreCase(code)) {
            return PUT;
        }
        throw new IllegalArgumentException("Unknown option right: " + code);
    }
}
