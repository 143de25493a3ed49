package com.statementprocessor.integration;

import static org.assertj.core.api.Assertions.assertThat;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.BalanceSource;
import com.statementprocessor.domain.enums.ProcessingStatus;
import com.statementprocessor.domain.model.ProcessingSummary;
import com.statementprocessor.entity.PortfolioSnapshotEntity;
import com.statementprocessor.entity.SnapshotForexBalanceEntity;
import com.statementprocessor.entity.TradeDetailEntity;
import com.statementprocessor.fixtures.StatementFixtures;
import com.statementprocessor.history.HistoricalWriter;
import com.statementprocessor.parser.CashForexSectionParser;
import com.statementprocessor.parser.MarkToMarketSectionParser;
import com.statementprocessor.parser.PositionsSectionParser;
import com.statementprocessor.parser.StatementInfoSectionParser;
import com.statementprocessor.parser.TradesSectionParser;
import com.statementprocessor.pipeline.StatementMetadataResolver;
import com.statementprocessor.pipeline.StatementPipeline;
import com.statementprocessor.reconciliation.ForexBalanceReconciler;
import com.statementprocessor.reconciliation.InstrumentClassifier;
import com.statementprocessor.reconciliation.OptionsCreditCalculator;
import com.statementprocessor.reconciliation.StatementReconciler;
import com.statementprocessor.repository.jpa.PortfolioSnapshotJpaRepository;
import com.statementprocessor.repository.jpa.SnapshotForexBalanceJpaRepository;
import com.statementprocessor.repository.jpa.SnapshotPositionJpaRepository;
import com.statementprocessor.repository.jpa.TradeDetailJpaRepository;
import com.statementprocessor.tokenizer.CsvLineSplitter;
import com.statementprocessor.tokenizer.SectionTokenizer;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;

/**
 * Runs the full pipeline against an in-memory H2 store: tokenize, parse, reconcile and write the
 * activity statement fixture, then ingest it again and check the store is unchanged.
 */
@DataJpaTest
@Import({HistoricalWriter.class, StatementProcessingConfig.class})
class HistoricalStoreIntegrationTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 1, 30);

    @Autowired
    private HistoricalWriter historicalWriter;

    @Autowired
    private StatementProcessingConfig config;

    @Autowired
    private PortfolioSnapshotJpaRepository snapshotJpaRepository;

    @Autowired
    private SnapshotForexBalanceJpaRepository forexBalanceJpaRepository;

    @Autowired
    private SnapshotPositionJpaRepository positionJpaRepository;

    @Autowired
    private TradeDetailJpaRepository tradeDetailJpaRepository;

    @Autowired
    private TestEntityManager entityManager;

    private StatementPipeline statementPipeline;

    @BeforeEach
    void setUp() {
        statementPipeline = new StatementPipeline(
                new SectionTokenizer(new CsvLineSplitter(), config),
                new StatementInfoSectionParser(),
                new TradesSectionParser(),
                new PositionsSectionParser(),
                new MarkToMarketSectionParser(),
                new CashForexSectionParser(),
                new StatementMetadataResolver(config),
                new StatementReconciler(
                        new InstrumentClassifier(), new OptionsCreditCalculator(), new ForexBalanceReconciler(), config),
                historicalWriter,
                event -> {},
                config);
    }

    private ProcessingSummary ingest(String documentId) {
        ProcessingSummary summary = statementPipeline.process(StatementFixtures.activityDocument(documentId));
        entityManager.flush();
        entityManager.clear();
        return summary;
    }

    @Test
    @DisplayName("Activity statement is written as one snapshot with its forex, position and trade rows")
    void firstIngestion() {
        ProcessingSummary summary = ingest("doc-1");

        assertThat(summary.getStatus()).isEqualTo(ProcessingStatus.SUCCESS);
        assertThat(summary.getRowsWritten()).isEqualTo(9);
        assertThat(summary.getSnapshotsOverwritten()).isZero();

        PortfolioSnapshotEntity snapshot = snapshotJpaRepository
                .findByAccountIdAndAsOfDate(StatementFixtures.ACCOUNT, AS_OF)
                .orElseThrow();
        assertThat(snapshot.getBaseCurrency()).isEqualTo("USD");
        assertThat(snapshot.getOptionsCredit()).isEqualByComparingTo("300");
        assertThat(snapshot.getShortOptionMarkValue()).isEqualByComparingTo("-240");
        assertThat(snapshot.getEquityPositionValue()).isEqualByComparingTo("23500");
        assertThat(snapshot.getOpenShortOptionCount()).isEqualTo(1);
        assertThat(snapshot.getSourceDocumentId()).isEqualTo("doc-1");

        List<SnapshotForexBalanceEntity> balances =
                forexBalanceJpaRepository.findBySnapshotIdOrderByCurrencyAsc(snapshot.getId());
        assertThat(balances)
                .extracting(SnapshotForexBalanceEntity::getCurrency)
                .containsExactly("EUR", "USD");
        assertThat(balances.get(0).getBalance()).isEqualByComparingTo("500");
        assertThat(balances.get(1).getBalance()).isEqualByComparingTo("9803.80");
        assertThat(balances.get(0).getBalanceSource()).isEqualTo(BalanceSource.FOREX_BALANCES);

        assertThat(positionJpaRepository.findBySnapshotId(snapshot.getId())).hasSize(2);
        assertThat(tradeDetailJpaRepository.countByAccountId(StatementFixtures.ACCOUNT)).isEqualTo(4);
    }

    @Test
    @DisplayName("Re-ingesting the same statement overwrites the snapshot and leaves row counts unchanged")
    void reingestionIsIdempotent() {
        ingest("doc-1");
        PortfolioSnapshotEntity first = snapshotJpaRepository
                .findByAccountIdAndAsOfDate(StatementFixtures.ACCOUNT, AS_OF)
                .orElseThrow();
        BigDecimal firstCredit = first.getOptionsCredit();
        BigDecimal firstOptionBalance = first.getOptionBalance();

        ProcessingSummary second = ingest("doc-2");

        assertThat(second.getStatus()).isEqualTo(ProcessingStatus.SUCCESS);
        assertThat(second.getSnapshotsOverwritten()).isEqualTo(1);
        assertThat(second.getTradeRowsAppended()).isZero();

        assertThat(snapshotJpaRepository.count()).isEqualTo(1);
        assertThat(forexBalanceJpaRepository.count()).isEqualTo(2);
        assertThat(positionJpaRepository.count()).isEqualTo(2);
        assertThat(tradeDetailJpaRepository.count()).isEqualTo(4);

        PortfolioSnapshotEntity rewritten = snapshotJpaRepository
                .findByAccountIdAndAsOfDate(StatementFixtures.ACCOUNT, AS_OF)
                .orElseThrow();
        assertThat(rewritten.getId()).isEqualTo(first.getId());
        assertThat(rewritten.getOptionsCredit()).isEqualByComparingTo(firstCredit);
        assertThat(rewritten.getOptionBalance()).isEqualByComparingTo(firstOptionBalance);
        assertThat(rewritten.getSourceDocumentId()).isEqualTo("doc-2");
        assertThat(rewritten.getUpdatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Trades of the same instrument on the same day keep their statement order")
    void tradeSequencesFollowStatementOrder() {
        ingest("doc-1");

        List<TradeDetailEntity> trades = tradeDetailJpaRepository.findByAccountIdOrderByExecutedAtAsc(
                StatementFixtures.ACCOUNT);
        List<TradeDetailEntity> closingLeg = trades.stream()
                .filter(trade -> trade.getInstrument().equals("ASTS 07FEB25 28 C"))
                .toList();
        assertThat(closingLeg)
                .extracting(TradeDetailEntity::getSequence)
                .containsExactly(1, 2);
        assertThat(closingLeg.get(1).getQuantity()).isEqualByComparingTo("1");
    }
}
