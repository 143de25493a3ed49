package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.RowType;
import java.util.List;
import lombok.Value;

/**
 * A single statement line after CSV splitting.
 *
 * <p>{@code values} excludes the leading section-name and row-type columns, so index 0 lines up with
 * the first entry of the section's header columns.
 */
@Value
public class SectionRow {

    int lineNumber;
    RowType rowType;
    String rowMarker;
    List<String> values;
    List<String> columns;

    /**
     * Returns the trimmed value of the named column, or null if the column is absent from the header,
     * the row is shorter than the header, or the cell is blank.
     */
    public String get(String column) {
        int index = indexOf(column);
        if (index < 0 || index >= values.size()) {
            return null;
        }
        String value = values.get(index);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /** First non-blank value among the given column names, for columns renamed across statement vintages. */
    public String getAny(String... candidates) {
        for (String candidate : candidates) {
            String value = get(candidate);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public boolean hasColumn(String column) {
        return indexOf(column) >= 0;
    }

    private int indexOf(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).trim().equalsIgnoreCase(column)) {
                return i;
            }
        }
        return -1;
    }
}
