package com.statementprocessor.parser;

import com.statementprocessor.domain.enums.WarningType;
import com.statementprocessor.domain.model.ParseResult;
import com.statementprocessor.domain.model.ProcessingWarning;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.SectionRow;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Row loop shared by all section parsers.
 *
 * <p>A section without a header, or whose header lacks a required column, cannot be mapped at all:
 * each of its data rows becomes a SECTION_UNPARSEABLE warning. Otherwise every data row goes through
 * {@link #parseRow}; a {@link FieldParseException} from that row becomes one field warning and the loop
 * moves on to the next row.
 */
public abstract class AbstractSectionParser<T> implements SectionParser<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractSectionParser.class);

    @Override
    public ParseResult<T> parse(Section section, ParseContext context) {
        List<SectionRow> rows = section.dataRows();
        List<T> records = new ArrayList<>(rows.size());
        List<ProcessingWarning> warnings = new ArrayList<>();

        String unmappable = checkHeader(section);
        if (unmappable != null) {
            log.warn("Section '{}' at line {} cannot be mapped: {}", section.getName(), section.getStartLine(), unmappable);
            for (SectionRow row : rows) {
                warnings.add(warning(section, row, context, WarningType.SECTION_UNPARSEABLE, null, unmappable));
            }
            return new ParseResult<>(records, warnings);
        }

        for (SectionRow row : rows) {
            try {
                records.add(parseRow(section, row, context));
            } catch (FieldParseException e) {
                warnings.add(warning(section, row, context, e.getWarningType(), e.getField(), e.getMessage()));
            }
        }

        if (!warnings.isEmpty()) {
            log.debug(
                    "Section '{}': {} records, {} lines skipped", section.getName(), records.size(), warnings.size());
        }
        return new ParseResult<>(records, warnings);
    }

    /** Columns without which no row of the section can be parsed. */
    protected abstract List<String> requiredColumns(Section section);

    /**
     * Builds the record for one data row.
     *
     * @throws FieldParseException if a cell is missing or malformed
     */
    protected abstract T parseRow(Section section, SectionRow row, ParseContext context);

    protected static String require(SectionRow row, String column) {
        String value = row.get(column);
        if (value == null) {
            throw FieldParseException.missing(column);
        }
        return value;
    }

    protected static String accountOf(SectionRow row, ParseContext context) {
        String account = row.get("Account");
        return account != null ? account : context.getAccountId();
    }

    private String checkHeader(Section section) {
        if (!section.hasHeader()) {
            return "section '" + section.getName() + "' has no header row";
        }
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns(section)) {
            if (!section.hasColumn(column)) {
                missing.add(column);
            }
        }
        return missing.isEmpty() ? null : "header lacks required columns " + missing;
    }

    private static ProcessingWarning warning(
            Section section, SectionRow row, ParseContext context, WarningType type, String field, String message) {
        return ProcessingWarning.builder()
                .type(type)
                .sectionKind(section.getKind())
                .sectionIndex(section.getIndex())
                .lineNumber(row.getLineNumber())
                .field(field)
                .accountId(accountOf(row, context))
                .message(message)
                .build();
    }
}
