package com.facility.snapshot.repository;

import com.facility.snapshot.model.ExecutionStatus;
import com.facility.snapshot.model.SnapshotExecution;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Executions are always ordered newest first by (execution_time, id); the id
 * breaks ties between executions sharing a timestamp.
 */
@Repository
public interface SnapshotExecutionRepository extends JpaRepository<SnapshotExecution, Long> {

    List<SnapshotExecution> findAllByOrderByExecutionTimeDescIdDesc(Pageable pageable);

    Optional<SnapshotExecution> findFirstByOrderByExecutionTimeDescIdDesc();

    long countByStatus(ExecutionStatus status);

    /**
     * Ids of every execution ordered strictly after the given boundary row.
     */
    @Query("SELECT e.id FROM SnapshotExecution e WHERE e.executionTime < :time " +
           "OR (e.executionTime = :time AND e.id < :id)")
    List<Long> findIdsOlderThan(@Param("time") Instant time, @Param("id") Long id);

    @Modifying
    @Query("DELETE FROM SnapshotExecution e WHERE e.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}
