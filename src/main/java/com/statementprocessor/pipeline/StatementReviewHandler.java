package com.statementprocessor.pipeline;

import com.statementprocessor.domain.enums.FailureType;
import com.statementprocessor.domain.model.ProcessingSummary;
import com.statementprocessor.event.StatementProcessedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Flags failed statements in the log.
 *
 * <p>Structural failures need a human to look at the document; persistence failures can be retried
 * unchanged. Successful runs with warnings are logged at WARN with the warning count only.
 */
@Component
public class StatementReviewHandler {

    private static final Logger log = LoggerFactory.getLogger(StatementReviewHandler.class);

    @EventListener
    @Order(10)
    public void onStatementProcessed(StatementProcessedEvent event) {
        ProcessingSummary summary = event.getSummary();

        if (summary.isSuccess()) {
            if (summary.getTotalWarnings() > 0) {
                log.warn(
                        "Statement {} processed with {} warnings ({} lines skipped)",
                        summary.getDocumentId(),
                        summary.getTotalWarnings(),
                        summary.getRecordsSkipped());
            }
            return;
        }

        if (summary.getFailureType() == FailureType.PERSISTENCE) {
            log.error(
                    "Statement {} for account {} was not written and can be retried: {}",
                    summary.getDocumentId(),
                    summary.getAccountId(),
                    summary.getErrorMessage());
        } else {
            log.error(
                    "Statement {} needs manual review: {} (sections found={}, unknown={})",
                    summary.getDocumentId(),
                    summary.getErrorMessage(),
                    summary.getSectionsFound(),
                    summary.getSectionsUnknown());
        }
    }
}
