package com.statementprocessor.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    STATEMENT_FORMAT_UNRECOGNIZED("STATEMENT_FORMAT_UNRECOGNIZED", 422),
    REQUIRED_SECTION_MISSING("REQUIRED_SECTION_MISSING", 422),
    STATEMENT_METADATA_MISSING("STATEMENT_METADATA_MISSING", 422),
    CURRENCY_MISMATCH("CURRENCY_MISMATCH", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PERSISTENCE_FAILED("PERSISTENCE_FAILED", 503);

    private final String code;
    private final int httpStatus;
}
