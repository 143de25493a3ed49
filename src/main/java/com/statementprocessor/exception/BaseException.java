package com.statementprocessor.exception;

import com.statementprocessor.domain.enums.FailureType;
import java.util.Map;
import lombok.Getter;

/**
 * Root of the service's exceptions.
 *
 * <p>The {@link ErrorCode} decides the HTTP status. Exceptions that end a statement run also carry the
 * {@link FailureType} recorded on its processing summary; it is null for everything else.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final FailureType failureType;
    private final Map<String, Object> details;

    protected BaseException(
            ErrorCode errorCode, FailureType failureType, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.failureType = failureType;
        this.details = details != null ? details : Map.of();
    }

    /** True when a statement can be submitted again unchanged. */
    public boolean isRetryable() {
        return failureType == FailureType.PERSISTENCE;
    }
}
