package com.statementprocessor.repository.jpa;

import com.statementprocessor.entity.PortfolioSnapshotEntity;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the portfolio_snapshots table.
 * Lookup by the natural key (account_id, as_of_date) drives the upsert in HistoricalWriter.
 */
@Repository
public interface PortfolioSnapshotJpaRepository extends JpaRepository<PortfolioSnapshotEntity, Long> {

    Optional<PortfolioSnapshotEntity> findByAccountIdAndAsOfDate(String accountId, LocalDate asOfDate);
}
