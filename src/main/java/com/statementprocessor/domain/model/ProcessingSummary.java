package com.statementprocessor.domain.model;

import com.statementprocessor.domain.enums.FailureType;
import com.statementprocessor.domain.enums.ProcessingStatus;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.exception.ErrorCode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Result of processing one statement document: what was found, what was skipped, what was written,
 * and whether the run succeeded. A run with warnings only is a success.
 */
@Data
@Builder
public class ProcessingSummary {

    private String documentId;
    private String accountId;
    private LocalDate asOfDate;

    private ProcessingStatus status;
    private FailureType failureType;
    private ErrorCode errorCode;
    private String errorMessage;

    private int sectionsFound;
    private int sectionsUnknown;

    @Builder.Default
    private Map<SectionKind, Integer> sectionsByKind = new EnumMap<>(SectionKind.class);

    private int recordsParsed;
    private int recordsSkipped;
    private int reconciliationWarnings;

    private int rowsWritten;
    private int snapshotsWritten;
    private int snapshotsOverwritten;
    private int tradeRowsAppended;

    @Builder.Default
    private List<ProcessingWarning> warnings = new ArrayList<>();

    private LocalDateTime startedAt;
    private long durationMs;

    public boolean isSuccess() {
        return status == ProcessingStatus.SUCCESS;
    }

    public int getTotalWarnings() {
        return warnings != null ? warnings.size() : 0;
    }
}
