package com.statementprocessor.repository.jpa;

import com.statementprocessor.entity.SnapshotPositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the snapshot_positions table.
 */
@Repository
public interface SnapshotPositionJpaRepository extends JpaRepository<SnapshotPositionEntity, Long> {

    List<SnapshotPositionEntity> findBySnapshotId(Long snapshotId);

    @Modifying
    @Query("DELETE FROM SnapshotPositionEntity p WHERE p.snapshotId = :snapshotId")
    int deleteBySnapshotId(@Param("snapshotId") Long snapshotId);
}
