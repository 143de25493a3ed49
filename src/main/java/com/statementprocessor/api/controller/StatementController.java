package com.statementprocessor.api.controller;

import com.statementprocessor.api.dto.request.ProcessStatementRequest;
import com.statementprocessor.domain.model.ProcessingSummary;
import com.statementprocessor.domain.model.StatementDocument;
import com.statementprocessor.exception.ErrorCode;
import com.statementprocessor.exception.StatementRejectedException;
import com.statementprocessor.pipeline.StatementPipeline;
import jakarta.validation.Valid;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for statement ingestion.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/statements} -- process one statement; a failed run is answered with an error
 *       (422 for a malformed document, 503 for a write failure)</li>
 *   <li>{@code POST /api/statements/batch} -- process several statements in order; every summary is
 *       returned, failed or not</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/statements")
public class StatementController {

    private static final String BOM = "\uFEFF";

    private final StatementPipeline statementPipeline;

    public StatementController(StatementPipeline statementPipeline) {
        this.statementPipeline = statementPipeline;
    }

    @PostMapping
    public ProcessingSummary processStatement(@RequestBody @Valid ProcessStatementRequest request) {
        ProcessingSummary summary = statementPipeline.process(toDocument(request));
        if (!summary.isSuccess()) {
            ErrorCode errorCode = summary.getErrorCode() != null ? summary.getErrorCode() : ErrorCode.INTERNAL_ERROR;
            throw new StatementRejectedException(
                    errorCode, summary.getFailureType(), summary.getErrorMessage(), failureDetails(summary));
        }
        return summary;
    }

    @PostMapping("/batch")
    public List<ProcessingSummary> processBatch(@RequestBody List<ProcessStatementRequest> requests) {
        List<StatementDocument> documents = requests.stream().map(this::toDocument).toList();
        return statementPipeline.processBatch(documents, () -> Thread.currentThread().isInterrupted());
    }

    private StatementDocument toDocument(ProcessStatementRequest request) {
        String content = request.getCsvContent() != null ? request.getCsvContent().replace(BOM, "") : "";
        return StatementDocument.builder()
                .documentId(UUID.randomUUID().toString())
                .rawText(content)
                .accountId(request.getAccountId())
                .periodStart(request.getPeriodStart())
                .periodEnd(request.getPeriodEnd())
                .baseCurrency(request.getBaseCurrency())
                .subject(request.getSubject())
                .filename(request.getFilename())
                .ingestedAt(LocalDateTime.now())
                .requiredSections(request.getRequiredSections() != null ? request.getRequiredSections() : Set.of())
                .build();
    }

    private static Map<String, Object> failureDetails(ProcessingSummary summary) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("documentId", summary.getDocumentId());
        details.put("failureType", String.valueOf(summary.getFailureType()));
        details.put("sectionsFound", summary.getSectionsFound());
        details.put("sectionsUnknown", summary.getSectionsUnknown());
        details.put("rowsWritten", summary.getRowsWritten());
        if (summary.getAccountId() != null) {
            details.put("accountId", summary.getAccountId());
        }
        return details;
    }
}
