package com.statementprocessor.history;

import com.statementprocessor.config.StatementProcessingConfig;
import com.statementprocessor.domain.model.ForexBalance;
import com.statementprocessor.domain.model.PortfolioSnapshot;
import com.statementprocessor.domain.model.PositionRecord;
import com.statementprocessor.domain.model.TradeRecord;
import com.statementprocessor.domain.model.WriteRequest;
import com.statementprocessor.domain.model.WriteResult;
import com.statementprocessor.entity.PortfolioSnapshotEntity;
import com.statementprocessor.entity.SnapshotForexBalanceEntity;
import com.statementprocessor.entity.SnapshotPositionEntity;
import com.statementprocessor.entity.TradeDetailEntity;
import com.statementprocessor.exception.StatementPersistenceException;
import com.statementprocessor.mapper.PortfolioSnapshotMapper;
import com.statementprocessor.mapper.SnapshotPositionMapper;
import com.statementprocessor.mapper.TradeDetailMapper;
import com.statementprocessor.repository.jpa.PortfolioSnapshotJpaRepository;
import com.statementprocessor.repository.jpa.SnapshotForexBalanceJpaRepository;
import com.statementprocessor.repository.jpa.SnapshotPositionJpaRepository;
import com.statementprocessor.repository.jpa.TradeDetailJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes reconciled snapshots and trade details to the historical store.
 *
 * <p>One call is one transaction: either every row of the statement commits or none does.
 * Snapshots are upserted on (account_id, as_of_date) with their forex and position rows replaced,
 * so re-ingesting a statement leaves the store unchanged. Trade details are append-only; a trade whose
 * (account, date, instrument, sequence) key already exists is skipped.
 */
@Service
public class HistoricalWriter {

    private static final Logger log = LoggerFactory.getLogger(HistoricalWriter.class);

    private final PortfolioSnapshotJpaRepository snapshotJpaRepository;
    private final SnapshotForexBalanceJpaRepository forexBalanceJpaRepository;
    private final SnapshotPositionJpaRepository positionJpaRepository;
    private final TradeDetailJpaRepository tradeDetailJpaRepository;
    private final StatementProcessingConfig config;

    private final PortfolioSnapshotMapper snapshotMapper = Mappers.getMapper(PortfolioSnapshotMapper.class);
    private final SnapshotPositionMapper positionMapper = Mappers.getMapper(SnapshotPositionMapper.class);
    private final TradeDetailMapper tradeDetailMapper = Mappers.getMapper(TradeDetailMapper.class);

    public HistoricalWriter(
            PortfolioSnapshotJpaRepository snapshotJpaRepository,
            SnapshotForexBalanceJpaRepository forexBalanceJpaRepository,
            SnapshotPositionJpaRepository positionJpaRepository,
            TradeDetailJpaRepository tradeDetailJpaRepository,
            StatementProcessingConfig config) {
        this.snapshotJpaRepository = snapshotJpaRepository;
        this.forexBalanceJpaRepository = forexBalanceJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.tradeDetailJpaRepository = tradeDetailJpaRepository;
        this.config = config;
    }

    /**
     * Persists one statement's output atomically.
     *
     * @throws StatementPersistenceException if any statement fails; the transaction is rolled back
     */
    @Transactional
    public WriteResult write(WriteRequest request) {
        try {
            int inserted = 0;
            int overwritten = 0;
            int forexRows = 0;
            int positionRows = 0;

            for (PortfolioSnapshot snapshot : request.getSnapshots()) {
                Upsert upsert = upsertSnapshot(snapshot, request.getDocumentId());
                if (upsert.overwritten()) {
                    overwritten++;
                } else {
                    inserted++;
                }
                Long snapshotId = upsert.entity().getId();
                forexRows += writeForexBalances(snapshotId, snapshot.getForexBalances());
                positionRows += writePositions(snapshotId, snapshot.getPositions());
            }

            int appended = 0;
            int skipped = 0;
            if (config.getHistory().isPersistTradeDetails()) {
                TradeAppend tradeAppend = appendTrades(request.getTrades(), request.getDocumentId());
                appended = tradeAppend.appended();
                skipped = tradeAppend.skipped();
            }

            // Surface constraint violations here rather than at commit
            snapshotJpaRepository.flush();

            WriteResult result = WriteResult.builder()
                    .snapshotsInserted(inserted)
                    .snapshotsOverwritten(overwritten)
                    .forexRowsWritten(forexRows)
                    .positionRowsWritten(positionRows)
                    .tradeRowsAppended(appended)
                    .tradeRowsSkipped(skipped)
                    .build();
            log.info(
                    "Statement {} written: snapshots inserted={}, overwritten={}, forexRows={}, positionRows={}, "
                            + "tradesAppended={}, tradesSkipped={}",
                    request.getDocumentId(),
                    inserted,
                    overwritten,
                    forexRows,
                    positionRows,
                    appended,
                    skipped);
            return result;
        } catch (DataAccessException e) {
            log.error("Historical write failed for statement {}: {}", request.getDocumentId(), e.getMessage());
            throw new StatementPersistenceException(
                    "Historical write failed: " + e.getMostSpecificCause().getMessage(),
                    Map.of("documentId", String.valueOf(request.getDocumentId())),
                    e);
        }
    }

    private Upsert upsertSnapshot(PortfolioSnapshot snapshot, String documentId) {
        LocalDateTime now = LocalDateTime.now();
        Optional<PortfolioSnapshotEntity> existing =
                snapshotJpaRepository.findByAccountIdAndAsOfDate(snapshot.getAccountId(), snapshot.getAsOfDate());

        if (existing.isPresent()) {
            PortfolioSnapshotEntity entity = existing.get();
            log.info(
                    "overwriting snapshot account={} asOf={} (id={})",
                    snapshot.getAccountId(),
                    snapshot.getAsOfDate(),
                    entity.getId());
            snapshotMapper.updateEntity(snapshot, entity);
            entity.setSourceDocumentId(documentId);
            entity.setUpdatedAt(now);
            forexBalanceJpaRepository.deleteBySnapshotId(entity.getId());
            positionJpaRepository.deleteBySnapshotId(entity.getId());
            return new Upsert(snapshotJpaRepository.save(entity), true);
        }

        PortfolioSnapshotEntity entity = snapshotMapper.toEntity(snapshot);
        entity.setSourceDocumentId(documentId);
        entity.setCreatedAt(now);
        return new Upsert(snapshotJpaRepository.save(entity), false);
    }

    private int writeForexBalances(Long snapshotId, List<ForexBalance> balances) {
        List<SnapshotForexBalanceEntity> rows = new ArrayList<>(balances.size());
        for (ForexBalance balance : balances) {
            SnapshotForexBalanceEntity row = snapshotMapper.toEntity(balance);
            row.setSnapshotId(snapshotId);
            rows.add(row);
        }
        forexBalanceJpaRepository.saveAll(rows);
        return rows.size();
    }

    private int writePositions(Long snapshotId, List<PositionRecord> positions) {
        List<SnapshotPositionEntity> rows = new ArrayList<>(positions.size());
        for (PositionRecord position : positions) {
            SnapshotPositionEntity row = positionMapper.toEntity(position);
            row.setSnapshotId(snapshotId);
            rows.add(row);
        }
        positionJpaRepository.saveAll(rows);
        return rows.size();
    }

    private TradeAppend appendTrades(List<TradeRecord> trades, String documentId) {
        Map<String, Integer> sequences = new HashMap<>();
        List<TradeDetailEntity> rows = new ArrayList<>();
        int skipped = 0;
        LocalDateTime now = LocalDateTime.now();

        for (TradeRecord trade : trades) {
            String key = trade.getAccountId() + "|" + trade.getTradeDate() + "|" + trade.getInstrument();
            int sequence = sequences.merge(key, 1, Integer::sum);
            if (tradeDetailJpaRepository.existsByAccountIdAndTradeDateAndInstrumentAndSequence(
                    trade.getAccountId(), trade.getTradeDate(), trade.getInstrument(), sequence)) {
                skipped++;
                continue;
            }
            TradeDetailEntity row = tradeDetailMapper.toEntity(trade);
            row.setSequence(sequence);
            row.setSourceDocumentId(documentId);
            row.setCreatedAt(now);
            rows.add(row);
        }
        tradeDetailJpaRepository.saveAll(rows);
        if (skipped > 0) {
            log.debug("Skipped {} trade details already present", skipped);
        }
        return new TradeAppend(rows.size(), skipped);
    }

    private record Upsert(PortfolioSnapshotEntity entity, boolean overwritten) {}

    private record TradeAppend(int appended, int skipped) {}
}
