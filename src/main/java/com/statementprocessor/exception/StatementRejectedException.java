package com.statementprocessor.exception;

import com.statementprocessor.domain.enums.FailureType;
import java.util.Map;

/**
 * Thrown at the HTTP boundary when a processed statement ended in a failed run, so the caller
 * receives an error response carrying the failure details from the processing summary.
 */
public class StatementRejectedException extends BaseException {

    public StatementRejectedException(
            ErrorCode errorCode, FailureType failureType, String message, Map<String, Object> details) {
        super(errorCode, failureType, message, details, null);
    }
}
