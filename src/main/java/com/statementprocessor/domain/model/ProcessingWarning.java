package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.enums.WarningType;
import lombok.Builder;
import lombok.Value;

/**
 * A recoverable anomaly recorded during a run. Field warnings carry section and line context;
 * reconciliation warnings carry the instrument and account they concern.
 */
@Value
@Builder
public class ProcessingWarning {

    WarningType type;
    SectionKind sectionKind;
    Integer sectionIndex;
    Integer lineNumber;
    String field;
    String accountId;
    String instrument;
    String message;

    public boolean isFieldWarning() {
        return type.isFieldWarning();
    }
}
