package com.statementprocessor.exception;

import com.statementprocessor.domain.enums.FailureType;
import java.util.Map;

/**
 * Structural failure of a statement document: no recognizable sections, a required section kind
 * missing, or metadata (account, as-of date, base currency) that cannot be resolved. Aborts the
 * document before anything is written; the document needs manual review.
 */
public class StatementFormatException extends BaseException {

    public StatementFormatException(String message) {
        this(ErrorCode.STATEMENT_FORMAT_UNRECOGNIZED, message, null);
    }

    public StatementFormatException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, FailureType.STRUCTURAL, message, details, null);
    }
}
