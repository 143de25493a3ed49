package com.statementprocessor.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Row counts of one committed statement write.
 */
@Value
@Builder
public class WriteResult {

    int snapshotsInserted;
    int snapshotsOverwritten;
    int forexRowsWritten;
    int positionRowsWritten;
    int tradeRowsAppended;
    int tradeRowsSkipped;

    public int getRowsWritten() {
        return snapshotsInserted + snapshotsOverwritten + forexRowsWritten + positionRowsWritten + tradeRowsAppended;
    }
}
