package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.ParseResult;
import com.statementprocessor.domain.model.Section;

/**
 * Converts one tokenized section into typed records.
 *
 * <p>Implementations are stateless and side-effect free. Every DATA row of the section yields exactly
 * one record or exactly one warning, never both and never neither.
 *
 * @param <T> record type produced for this section kind
 */
public interface SectionParser<T> {

    SectionKind kind();

    default boolean supports(SectionKind sectionKind) {
        return kind() == sectionKind;
    }

    ParseResult<T> parse(Section section, ParseContext context);
}
