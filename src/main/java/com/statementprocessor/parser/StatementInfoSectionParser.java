package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import com.statementprocessor.domain.model.StatementField;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Reads the name/value rows of the Statement and Account Information sections ("Period",
 * "WhenGenerated", "Account", "Base Currency", ...). Interpretation is left to the metadata resolver.
 */
@Component
public class StatementInfoSectionParser extends AbstractSectionParser<StatementField> {

    static final String FIELD_NAME = "Field Name";
    static final String FIELD_VALUE = "Field Value";

    @Override
    public SectionKind kind() {
        return SectionKind.STATEMENT_INFO;
    }

    /** Also handles {@link SectionKind#ACCOUNT_INFO}, which shares the same two-column layout. */
    @Override
    public boolean supports(SectionKind kind) {
        return kind == SectionKind.STATEMENT_INFO || kind == SectionKind.ACCOUNT_INFO;
    }

    @Override
    protected List<String> requiredColumns(Section section) {
        return List.of(FIELD_NAME, FIELD_VALUE);
    }

    @Override
    protected StatementField parseRow(Section section, SectionRow row, ParseContext context) {
        return new StatementField(section.getKind(), require(row, FIELD_NAME), row.get(FIELD_VALUE));
    }
}
