package com.statementprocessor.exception;

import com.statementprocessor.domain.enums.FailureType;
import java.util.Map;

/**
 * The transactional write of a statement's rows failed and was rolled back in full.
 * The statement can be retried unchanged.
 */
public class StatementPersistenceException extends BaseException {

    public StatementPersistenceException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public StatementPersistenceException(String message, Map<String, Object> details, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILED, FailureType.PERSISTENCE, message, details, cause);
    }
}
