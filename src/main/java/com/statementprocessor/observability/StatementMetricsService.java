package com.statementprocessor.observability;

import com.statementprocessor.domain.model.ProcessingSummary;
import com.statementprocessor.event.StatementProcessedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for statement processing, exposed through the actuator metrics endpoint:
 * <ul>
 *   <li><b>statements.processed</b> (counter): documents that completed successfully</li>
 *   <li><b>statements.failed</b> (counter, tag failure_type): documents rejected or rolled back</li>
 *   <li><b>statements.warnings</b> (counter): field and reconciliation warnings raised</li>
 *   <li><b>statements.duration</b> (timer): end-to-end processing time per document</li>
 * </ul>
 */
@Service
public class StatementMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter processedCounter;
    private final Counter warningsCounter;
    private final Timer durationTimer;

    public StatementMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.processedCounter = Counter.builder("statements.processed")
                .description("Statements processed and written successfully")
                .register(meterRegistry);
        this.warningsCounter = Counter.builder("statements.warnings")
                .description("Field and reconciliation warnings raised while processing statements")
                .register(meterRegistry);
        this.durationTimer = Timer.builder("statements.duration")
                .description("End-to-end processing time of one statement")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onStatementProcessed(StatementProcessedEvent event) {
        ProcessingSummary summary = event.getSummary();
        if (summary.isSuccess()) {
            processedCounter.increment();
        } else {
            Counter.builder("statements.failed")
                    .description("Statements rejected as malformed or rolled back on write failure")
                    .tag("failure_type", String.valueOf(summary.getFailureType()))
                    .register(meterRegistry)
                    .increment();
        }
        if (summary.getTotalWarnings() > 0) {
            warningsCounter.increment(summary.getTotalWarnings());
        }
        durationTimer.record(summary.getDurationMs(), TimeUnit.MILLISECONDS);
    }
}
