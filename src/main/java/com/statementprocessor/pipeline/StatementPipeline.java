package com.statementprocessor.pipeline;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.ProcessingStatus;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.model.ParseResult;
import com.statementprocessor.domain.model.ParsedStatement;
import com.statementprocessor.domain.model.ProcessingSummary;
import com.statementprocessor.domain.model.ProcessingWarning;
import com.statementprocessor.domain.model.ReconciliationOutcome;
import com.statementprocessor.domain.model.Section;
import com.statementprocessor.domain.model.StatementDocument;
import com.statementprocessor.domain.model.StatementMetadata;
import com.statementprocessor.domain.model.WriteRequest;
import com.statementprocessor.domain.model.WriteResult;
import com.statementprocessor.event.StatementProcessedEvent;
import com.statementprocessor.exception.BaseException;
import com.statementprocessor.exception.ErrorCode;
import com.statementprocessor.exception.StatementFormatException;
import com.statementprocessor.exception.StatementPersistenceException;
import com.statementprocessor.history.HistoricalWriter;
import com.statementprocessor.parser.CashForexSectionParser;
import com.statementprocessor.parser.MarkToMarketSectionParser;
import com.statementprocessor.parser.ParseContext;
import com.statementprocessor.parser.PositionsSectionParser;
import com.statementprocessor.parser.StatementInfoSectionParser;
import com.statementprocessor.parser.TradesSectionParser;
import com.statementprocessor.reconciliation.StatementReconciler;
import com.statementprocessor.tokenizer.SectionTokenizer;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Runs one statement document end to end: tokenize, parse, reconcile, write.
 *
 * <p>Recoverable problems (a bad line, an unclassifiable instrument) become warnings in the summary and
 * the run still succeeds. Structural problems (no recognizable section, a required section missing,
 * unresolvable account or date) abort before any write. A failed write rolls back completely. In every
 * case a {@link StatementProcessedEvent} is published with the summary.
 */
@Service
public class StatementPipeline {

    private static final Logger log = LoggerFactory.getLogger(StatementPipeline.class);

    private static final Set<SectionKind> POSITION_SOURCES = EnumSet.of(SectionKind.POSITIONS, SectionKind.MTM_SUMMARY);

    private final SectionTokenizer sectionTokenizer;
    private final StatementInfoSectionParser statementInfoParser;
    private final TradesSectionParser tradesParser;
    private final PositionsSectionParser positionsParser;
    private final MarkToMarketSectionParser markToMarketParser;
    private final CashForexSectionParser cashForexParser;
    private final StatementMetadataResolver metadataResolver;
    private final StatementReconciler statementReconciler;
    private final HistoricalWriter historicalWriter;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final StatementProcessingConfig config;

    public StatementPipeline(
            SectionTokenizer sectionTokenizer,
            StatementInfoSectionParser statementInfoParser,
            TradesSectionParser tradesParser,
            PositionsSectionParser positionsParser,
            MarkToMarketSectionParser markToMarketParser,
            CashForexSectionParser cashForexParser,
            StatementMetadataResolver metadataResolver,
            StatementReconciler statementReconciler,
            HistoricalWriter historicalWriter,
            ApplicationEventPublisher applicationEventPublisher,
            StatementProcessingConfig config) {
        this.sectionTokenizer = sectionTokenizer;
        this.statementInfoParser = statementInfoParser;
        this.tradesParser = tradesParser;
        this.positionsParser = positionsParser;
        this.markToMarketParser = markToMarketParser;
        this.cashForexParser = cashForexParser;
        this.metadataResolver = metadataResolver;
        this.statementReconciler = statementReconciler;
        this.historicalWriter = historicalWriter;
        this.applicationEventPublisher = applicationEventPublisher;
        this.config = config;
    }

    /**
     * Processes one document. Never throws for bad input or write failures; the outcome is in the
     * returned summary.
     */
    public ProcessingSummary process(StatementDocument document) {
        LocalDateTime startedAt = LocalDateTime.now();
        String documentId = document.getDocumentId() != null
                ? document.getDocumentId()
                : UUID.randomUUID().toString();
        ProcessingSummary summary = ProcessingSummary.builder()
                .documentId(documentId)
                .startedAt(startedAt)
                .status(ProcessingStatus.SUCCESS)
                .build();
        log.info("Processing statement {} (subject={}, file={})", documentId, document.getSubject(), document.getFilename());

        try {
            List<Section> sections = sectionTokenizer.tokenize(document);
            recordSections(summary, sections);

            ParsedStatement parsed = ParsedStatement.builder().build();
            for (Section section : sections) {
                if (statementInfoParser.supports(section.getKind())) {
                    collect(statementInfoParser.parse(section, ParseContext.empty()), parsed.getFields(), parsed);
                }
            }

            StatementMetadata metadata = metadataResolver.resolve(document, parsed.getFields());
            summary.setAccountId(metadata.getAccountId());
            summary.setAsOfDate(metadata.getPeriodEnd());
            requireSections(summary, document);

            ParseContext context = ParseContext.builder()
                    .accountId(metadata.getAccountId())
                    .baseCurrency(metadata.getBaseCurrency())
                    .asOfDate(metadata.getPeriodEnd())
                    .optionMultiplier(config.getOptionMultiplier())
                    .build();
            for (Section section : sections) {
                parseSection(section, context, parsed);
            }

            ReconciliationOutcome outcome = statementReconciler.reconcile(parsed, metadata);

            List<ProcessingWarning> warnings = new ArrayList<>(parsed.getWarnings());
            warnings.addAll(outcome.warnings());
            summary.setWarnings(warnings);
            summary.setRecordsParsed(parsed.getRecordsParsed());
            summary.setRecordsSkipped(parsed.getWarnings().size());
            summary.setReconciliationWarnings(outcome.warnings().size());

            WriteResult written = historicalWriter.write(WriteRequest.builder()
                    .documentId(documentId)
                    .snapshots(outcome.snapshots())
                    .trades(outcome.trades())
                    .build());
            summary.setRowsWritten(written.getRowsWritten());
            summary.setSnapshotsWritten(written.getSnapshotsInserted() + written.getSnapshotsOverwritten());
            summary.setSnapshotsOverwritten(written.getSnapshotsOverwritten());
            summary.setTradeRowsAppended(written.getTradeRowsAppended());
        } catch (StatementFormatException | StatementPersistenceException e) {
            fail(summary, e);
        } catch (DataAccessException | TransactionException e) {
            // Raised at commit time, outside the writer's own error translation
            fail(summary, new StatementPersistenceException("Historical write failed: " + e.getMessage(), e));
        }

        summary.setDurationMs(Duration.between(startedAt, LocalDateTime.now()).toMillis());
        log.info(
                "Statement {} {}: account={}, asOf={}, sections={} ({} unknown), records={}, skipped={}, "
                        + "reconciliationWarnings={}, rowsWritten={}, overwritten={}, {}ms",
                documentId,
                summary.getStatus(),
                summary.getAccountId(),
                summary.getAsOfDate(),
                summary.getSectionsFound(),
                summary.getSectionsUnknown(),
                summary.getRecordsParsed(),
                summary.getRecordsSkipped(),
                summary.getReconciliationWarnings(),
                summary.getRowsWritten(),
                summary.getSnapshotsOverwritten(),
                summary.getDurationMs());

        applicationEventPublisher.publishEvent(new StatementProcessedEvent(this, summary));
        return summary;
    }

    /**
     * Processes documents one after another. Cancellation is checked between documents only, so a
     * document that has started always completes or rolls back as a unit.
     */
    public List<ProcessingSummary> processBatch(List<StatementDocument> documents, BooleanSupplier cancelled) {
        List<ProcessingSummary> summaries = new ArrayList<>(documents.size());
        for (StatementDocument document : documents) {
            if (cancelled.getAsBoolean()) {
                log.info("Batch cancelled after {} of {} statements", summaries.size(), documents.size());
                break;
            }
            summaries.add(process(document));
        }
        return summaries;
    }

    private void parseSection(Section section, ParseContext context, ParsedStatement parsed) {
        switch (section.getKind()) {
            case TRADES -> collect(tradesParser.parse(section, context), parsed.getTrades(), parsed);
            case POSITIONS -> collect(positionsParser.parse(section, context), parsed.getPositions(), parsed);
            case MTM_SUMMARY -> collect(markToMarketParser.parse(section, context), parsed.getMarkToMarket(), parsed);
            case CASH_FOREX -> collect(cashForexParser.parse(section, context), parsed.getCashForex(), parsed);
            case STATEMENT_INFO, ACCOUNT_INFO -> {
                // parsed before metadata resolution
            }
            case UNKNOWN -> log.debug(
                    "Skipping unrecognized section '{}' (lines {}-{})",
                    section.getName(),
                    section.getStartLine(),
                    section.getEndLine());
        }
    }

    private static <T> void collect(ParseResult<T> result, List<T> target, ParsedStatement parsed) {
        target.addAll(result.records());
        parsed.getWarnings().addAll(result.warnings());
        parsed.setRecordsParsed(parsed.getRecordsParsed() + result.records().size());
    }

    private static void recordSections(ProcessingSummary summary, List<Section> sections) {
        Map<SectionKind, Integer> byKind = new EnumMap<>(SectionKind.class);
        int unknown = 0;
        for (Section section : sections) {
            byKind.merge(section.getKind(), 1, Integer::sum);
            if (!section.isRecognized()) {
                unknown++;
            }
        }
        summary.setSectionsFound(sections.size());
        summary.setSectionsUnknown(unknown);
        summary.setSectionsByKind(byKind);
    }

    private void requireSections(ProcessingSummary summary, StatementDocument document) {
        Set<SectionKind> present = summary.getSectionsByKind().keySet();
        if (present.stream().noneMatch(POSITION_SOURCES::contains)) {
            throw new StatementFormatException(
                    ErrorCode.REQUIRED_SECTION_MISSING,
                    "Statement has neither an Open Positions nor a Mark-to-Market section",
                    Map.of("sectionsFound", present.toString()));
        }
        Set<SectionKind> required = EnumSet.noneOf(SectionKind.class);
        required.addAll(document.getRequiredSections());
        required.addAll(config.getRequiredSections());
        required.removeAll(present);
        if (!required.isEmpty()) {
            throw new StatementFormatException(
                    ErrorCode.REQUIRED_SECTION_MISSING,
                    "Statement is missing required sections " + required,
                    Map.of("missing", required.toString()));
        }
    }

    private static void fail(ProcessingSummary summary, BaseException e) {
        summary.setStatus(ProcessingStatus.FAILED);
        summary.setFailureType(e.getFailureType());
        summary.setErrorCode(e.getErrorCode());
        summary.setErrorMessage(e.getMessage());
        summary.setRowsWritten(0);
        summary.setSnapshotsWritten(0);
        summary.setSnapshotsOverwritten(0);
        summary.setTradeRowsAppended(0);
    }
}
