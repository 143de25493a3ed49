package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.RowType;
import com.statementprocessor.domain.enums.SectionKind;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A contiguous, labeled region of a statement document.
 *
 * <p>Line numbers are 1-based and inclusive. {@code ruleName} records which tokenizer rule matched the
 * header, or null for UNKNOWN sections.
 */
@Value
@Builder
public class Section {

    int index;
    SectionKind kind;
    String name;
    String ruleName;
    int startLine;
    int endLine;

    @Builder.Default
    List<String> columns = List.of();

    @Builder.Default
    List<SectionRow> rows = List.of();

    public List<SectionRow> dataRows() {
        return rows.stream().filter(row -> row.getRowType() == RowType.DATA).toList();
    }

    /** Number of DATA rows; every one of them must surface as a parsed record or a warning. */
    public int dataLineCount() {
        return (int) rows.stream().filter(row -> row.getRowType() == RowType.DATA).count();
    }

    public boolean hasHeader() {
        return !columns.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columns.stream().anyMatch(name -> name.trim().equalsIgnoreCase(column));
    }

    public boolean isRecognized() {
        return kind != SectionKind.UNKNOWN;
    }
}
