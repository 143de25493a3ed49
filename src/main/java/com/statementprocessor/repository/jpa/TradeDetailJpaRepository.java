package com.statementprocessor.repository.jpa;

import com.statementprocessor.entity.TradeDetailEntity;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trade_details table.
 * Append-only: rows are inserted once per natural key and never updated.
 */
@Repository
public interface TradeDetailJpaRepository extends JpaRepository<TradeDetailEntity, Long> {

    boolean existsByAccountIdAndTradeDateAndInstrumentAndSequence(
            String accountId, LocalDate tradeDate, String instrument, int sequence);

    List<TradeDetailEntity> findByAccountIdOrderByExecutedAtAsc(String accountId);

    long countByAccountId(String accountId);
}
