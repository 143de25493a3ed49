package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.WarningType;
import lombok.Getter;

/**
 * Raised by the field parsers when a single cell cannot be converted. Section parsers catch it per line
 * and turn it into a {@link WarningType field warning}; it never leaves the parser package.
 */
@Getter
public class FieldParseException extends RuntimeException {

    private final WarningType warningType;
    private final String field;

    public FieldParseException(WarningType warningType, String field, String message) {
        super(message);
        this.warningType = warningType;
        this.field = field;
    }

    public static FieldParseException missing(String field) {
        return new FieldParseException(WarningType.FIELD_MISSING, field, "Missing value for '" + field + "'");
    }
}
