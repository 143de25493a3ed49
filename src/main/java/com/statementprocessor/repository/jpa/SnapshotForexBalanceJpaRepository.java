package com.statementprocessor.repository.jpa;

import com.statementprocessor.entity.SnapshotForexBalanceEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the snapshot_forex_balances table.
 */
@Repository
public interface SnapshotForexBalanceJpaRepository extends JpaRepository<SnapshotForexBalanceEntity, Long> {

    List<SnapshotForexBalanceEntity> findBySnapshotIdOrderByCurrencyAsc(Long snapshotId);

    /** Removes the balances of a snapshot before it is rewritten. Runs inside the caller's transaction. */
    @Modifying
    @Query("DELETE FROM SnapshotForexBalanceEntity f WHERE f.snapshotId = :snapshotId")
    int deleteBySnapshotId(@Param("snapshotId") Long snapshotId);
}
