package com.statementprocessor.domain.model;

import java.util.List;

/**
 * Output of one section parser: the records it could build and one warning per line it skipped.
 */
public record ParseResult<T>(List<T> records, List<ProcessingWarning> warnings) {

    public ParseResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
    }

    public static <T> ParseResult<T> empty() {
        return new ParseResult<>(List.of(), List.of());
    }
}
