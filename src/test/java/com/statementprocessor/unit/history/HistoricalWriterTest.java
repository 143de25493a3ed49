package com.statementprocessor.unit.history;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.enums.AssetClass;
import com.statementprocessor.domain.enums.BalanceSource;
import com.statementprocessor.domain.enums.SectionKind;
import com.statementprocessor.domain.enums.TradeAction;
import com.statementprocessor.domain.model.ForexBalance;
import com.statementprocessor.domain.model.PortfolioSnapshot;
import com.statementprocessor.domain.model.PositionRecord;
import com.statementprocessor.domain.model.TradeRecord;
import com.statementprocessor.domain.model.WriteRequest;
import com.statementprocessor.domain.model.WriteResult;
import com.statementprocessor.domain.vo.Money;
import com.statementprocessor.entity.PortfolioSnapshotEntity;
import com.statementprocessor.entity.SnapshotForexBalanceEntity;
import com.statementprocessor.entity.TradeDetailEntity;
import com.statementprocessor.exception.ErrorCode;
import com.statementprocessor.exception.StatementPersistenceException;
import com.statementprocessor.history.HistoricalWriter;
import com.statementprocessor.repository.jpa.PortfolioSnapshotJpaRepository;
import com.statementprocessor.repository.jpa.SnapshotForexBalanceJpaRepository;
import com.statementprocessor.repository.jpa.SnapshotPositionJpaRepository;
import com.statementprocessor.repository.jpa.TradeDetailJpaRepository;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class HistoricalWriterTest {

    private static final String ACCOUNT = "U1234567";
    private static final LocalDate AS_OF = LocalDate.of(2025, 1, 30);

    @Mock
    private PortfolioSnapshotJpaRepository snapshotJpaRepository;

    @Mock
    private SnapshotForexBalanceJpaRepository forexBalanceJpaRepository;

    @Mock
    private SnapshotPositionJpaRepository positionJpaRepository;

    @Mock
    private TradeDetailJpaRepository tradeDetailJpaRepository;

    private StatementProcessingConfig config;
    private HistoricalWriter historicalWriter;

    @BeforeEach
    void setUp() {
        config = new StatementProcessingConfig();
        historicalWriter = new HistoricalWriter(
                snapshotJpaRepository, forexBalanceJpaRepository, positionJpaRepository, tradeDetailJpaRepository, config);
    }

    private static PortfolioSnapshot snapshot(String optionsCredit) {
        return PortfolioSnapshot.builder()
                .accountId(ACCOUNT)
                .asOfDate(AS_OF)
                .periodStart(AS_OF)
                .baseCurrency("USD")
                .optionsCredit(Money.of(new BigDecimal(optionsCredit), "USD"))
                .shortOptionMarkValue(Money.of(new BigDecimal("-240"), "USD"))
                .longOptionMarkValue(Money.zero("USD"))
                .equityPositionValue(Money.of(new BigDecimal("23500"), "USD"))
                .openShortOptionCount(1)
                .forexBalances(List.of(
                        ForexBalance.builder()
                                .accountId(ACCOUNT)
                                .currency("EUR")
                                .balance(new BigDecimal("500"))
                                .asOfDate(AS_OF)
                                .source(BalanceSource.FOREX_BALANCES)
                                .build(),
                        ForexBalance.builder()
                                .accountId(ACCOUNT)
                                .currency("USD")
                                .balance(new BigDecimal("9803.80"))
                                .asOfDate(AS_OF)
                                .source(BalanceSource.CASH_REPORT)
                                .build()))
                .positions(List.of(PositionRecord.builder()
                        .accountId(ACCOUNT)
                        .instrument("AAPL")
                        .assetClass(AssetClass.EQUITY)
                        .currency("USD")
                        .quantity(new BigDecimal("100"))
                        .multiplier(BigDecimal.ONE)
                        .marketValue(new BigDecimal("23500"))
                        .source(SectionKind.POSITIONS)
                        .build()))
                .build();
    }

    private static TradeRecord trade(String instrument, String quantity, int hour) {
        return TradeRecord.builder()
                .accountId(ACCOUNT)
                .instrument(instrument)
                .assetClass(AssetClass.OPTION)
                .action(new BigDecimal(quantity).signum() < 0 ? TradeAction.SELL : TradeAction.BUY)
                .quantity(new BigDecimal(quantity))
                .currency("USD")
                .tradeDate(AS_OF)
                .executedAt(AS_OF.atTime(hour, 0))
                .build();
    }

    private static WriteRequest request(PortfolioSnapshot snapshot, List<TradeRecord> trades) {
        return WriteRequest.builder().documentId("doc-1").snapshots(List.of(snapshot)).trades(trades).build();
    }

    private void savedSnapshotsGetId(long id) {
        when(snapshotJpaRepository.save(any(PortfolioSnapshotEntity.class))).thenAnswer(invocation -> {
            PortfolioSnapshotEntity entity = invocation.getArgument(0);
            if (entity.getId() == null) {
                entity.setId(id);
            }
            return entity;
        });
    }

    @Nested
    @DisplayName("First write for an account and date")
    class Insert {

        @Test
        @DisplayName("Inserts the snapshot, its forex and position rows, and the trades")
        @SuppressWarnings("unchecked")
        void insertsEverything() {
            when(snapshotJpaRepository.findByAccountIdAndAsOfDate(ACCOUNT, AS_OF)).thenReturn(Optional.empty());
            savedSnapshotsGetId(11L);

            WriteResult result = historicalWriter.write(request(
                    snapshot("300"),
                    List.of(trade("ASTS 07FEB25 28 C", "-1", 10), trade("ASTS 07FEB25 28 C", "1", 14))));

            assertThat(result.getSnapshotsInserted()).isEqualTo(1);
            assertThat(result.getSnapshotsOverwritten()).isZero();
            assertThat(result.getForexRowsWritten()).isEqualTo(2);
            assertThat(result.getPositionRowsWritten()).isEqualTo(1);
            assertThat(result.getTradeRowsAppended()).isEqualTo(2);
            assertThat(result.getRowsWritten()).isEqualTo(6);

            ArgumentCaptor<PortfolioSnapshotEntity> saved = ArgumentCaptor.forClass(PortfolioSnapshotEntity.class);
            verify(snapshotJpaRepository).save(saved.capture());
            assertThat(saved.getValue().getOptionsCredit()).isEqualByComparingTo("300");
            assertThat(saved.getValue().getOptionBalance()).isEqualByComparingTo("-240");
            assertThat(saved.getValue().getSourceDocumentId()).isEqualTo("doc-1");
            assertThat(saved.getValue().getCreatedAt()).isNotNull();

            ArgumentCaptor<List<SnapshotForexBalanceEntity>> forexRows = ArgumentCaptor.forClass(List.class);
            verify(forexBalanceJpaRepository).saveAll(forexRows.capture());
            assertThat(forexRows.getValue())
                    .extracting(SnapshotForexBalanceEntity::getCurrency)
                    .containsExactly("EUR", "USD");
            assertThat(forexRows.getValue()).allMatch(row -> row.getSnapshotId() == 11L);

            ArgumentCaptor<List<TradeDetailEntity>> tradeRows = ArgumentCaptor.forClass(List.class);
            verify(tradeDetailJpaRepository).saveAll(tradeRows.capture());
            assertThat(tradeRows.getValue()).extracting(TradeDetailEntity::getSequence).containsExactly(1, 2);
            verify(forexBalanceJpaRepository, never()).deleteBySnapshotId(any());
        }

        @Test
        @DisplayName("Trade rows already stored by an earlier run are skipped")
        void skipsStoredTrades() {
            when(snapshotJpaRepository.findByAccountIdAndAsOfDate(ACCOUNT, AS_OF)).thenReturn(Optional.empty());
            savedSnapshotsGetId(11L);
            when(tradeDetailJpaRepository.existsByAccountIdAndTradeDateAndInstrumentAndSequence(
                            eq(ACCOUNT), eq(AS_OF), anyString(), anyInt()))
                    .thenReturn(true, false);

            WriteResult result = historicalWriter.write(request(
                    snapshot("300"),
                    List.of(trade("ASTS 07FEB25 26 C", "-2", 10), trade("ASTS 07FEB25 26 C", "1", 11))));

            assertThat(result.getTradeRowsAppended()).isEqualTo(1);
            assertThat(result.getTradeRowsSkipped()).isEqualTo(1);
        }

        @Test
        @DisplayName("Trade details are not touched when disabled")
        void tradeDetailsDisabled() {
            config.getHistory().setPersistTradeDetails(false);
            when(snapshotJpaRepository.findByAccountIdAndAsOfDate(ACCOUNT, AS_OF)).thenReturn(Optional.empty());
            savedSnapshotsGetId(11L);

            WriteResult result =
                    historicalWriter.write(request(snapshot("300"), List.of(trade("ASTS 07FEB25 26 C", "-2", 10))));

            assertThat(result.getTradeRowsAppended()).isZero();
            verifyNoInteractions(tradeDetailJpaRepository);
        }
    }

    @Nested
    @DisplayName("Rewrite of an existing account and date")
    class Overwrite {

        @Test
        @DisplayName("Overwrites the business fields in place and replaces the child rows")
        void overwritesInPlace() {
            PortfolioSnapshotEntity existing = PortfolioSnapshotEntity.builder()
                    .id(7L)
                    .accountId(ACCOUNT)
                    .asOfDate(AS_OF)
                    .baseCurrency("USD")
                    .optionsCredit(new BigDecimal("100"))
                    .createdAt(LocalDateTime.of(2025, 1, 31, 6, 0))
                    .build();
            when(snapshotJpaRepository.findByAccountIdAndAsOfDate(ACCOUNT, AS_OF)).thenReturn(Optional.of(existing));
            when(snapshotJpaRepository.save(existing)).thenReturn(existing);

            WriteResult result = historicalWriter.write(request(snapshot("300"), List.of()));

            assertThat(result.getSnapshotsOverwritten()).isEqualTo(1);
            assertThat(result.getSnapshotsInserted()).isZero();
            assertThat(existing.getId()).isEqualTo(7L);
            assertThat(existing.getOptionsCredit()).isEqualByComparingTo("300");
            assertThat(existing.getCreatedAt()).isEqualTo(LocalDateTime.of(2025, 1, 31, 6, 0));
            assertThat(existing.getUpdatedAt()).isNotNull();
            verify(forexBalanceJpaRepository).deleteBySnapshotId(7L);
            verify(positionJpaRepository).deleteBySnapshotId(7L);
        }
    }

    @Test
    @DisplayName("Database errors surface as a persistence failure carrying the document id")
    void databaseError() {
        when(snapshotJpaRepository.findByAccountIdAndAsOfDate(ACCOUNT, AS_OF)).thenReturn(Optional.empty());
        when(snapshotJpaRepository.save(any(PortfolioSnapshotEntity.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for column account_id"));

        assertThatThrownBy(() -> historicalWriter.write(request(snapshot("300"), List.of())))
                .isInstanceOf(StatementPersistenceException.class)
                .satisfies(e -> {
                    StatementPersistenceException error = (StatementPersistenceException) e;
                    assertThat(error.getErrorCode()).isEqualTo(ErrorCode.PERSISTENCE_FAILED);
                    assertThat(error.getDetails()).containsEntry("documentId", "doc-1");
                });
        verify(forexBalanceJpaRepository, never()).saveAll(anyList());
    }
}
