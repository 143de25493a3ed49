package com.statementprocessor.event;

import com.statementprocessor.domain.model.ProcessingSummary;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per statement document after processing finished, successfully or not.
 * The publish time is {@link #getTimestamp()}.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>StatementReviewHandler: logs failed statements for manual review or retry</li>
 *   <li>StatementMetricsService: processed / failed / warning counters</li>
 * </ul>
 */
public class StatementProcessedEvent extends ApplicationEvent {

    private final ProcessingSummary summary;

    public StatementProcessedEvent(Object source, ProcessingSummary summary) {
        super(source);
        this.summary = summary;
    }

    public ProcessingSummary getSummary() {
        return summary;
    }
}
