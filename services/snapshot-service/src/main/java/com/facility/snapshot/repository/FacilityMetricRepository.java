package com.facility.snapshot.repository;

import com.facility.snapshot.model.FacilityMetric;
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

@Repository
public interface FacilityMetricRepository extends JpaRepository<FacilityMetric, Long> {

    @Query("SELECT m FROM FacilityMetric m JOIN FETCH m.facility JOIN FETCH m.hvacStatus " +
           "WHERE m.snapshot.id = :snapshotId ORDER BY m.facility.id ASC")
    List<FacilityMetric> findBySnapshotId(@Param("snapshotId") Long snapshotId);

    @Query("SELECT COUNT(m) FROM FacilityMetric m WHERE m.snapshot.id = :snapshotId")
    long countBySnapshotId(@Param("snapshotId") Long snapshotId);

    @Query("SELECT COUNT(m) FROM FacilityMetric m WHERE m.snapshot.id IN :snapshotIds")
    long countBySnapshotIdIn(@Param("snapshotIds") Collection<Long> snapshotIds);

    @Query("SELECT m FROM FacilityMetric m JOIN FETCH m.hvacStatus " +
           "WHERE m.snapshot.id = :snapshotId AND m.facility.id = :facilityId")
    Optional<FacilityMetric> findBySnapshotIdAndFacilityId(
            @Param("snapshotId") Long snapshotId, @Param("facilityId") String facilityId);

    @Query("SELECT m FROM FacilityMetric m JOIN FETCH m.snapshot JOIN FETCH m.hvacStatus " +
           "WHERE m.facility.id = :facilityId ORDER BY m.recordedAt DESC, m.id DESC")
    List<FacilityMetric> findHistory(@Param("facilityId") String facilityId, Pageable pageable);

    @Query("SELECT new com.facility.snapshot.repository.MetricAverages(" +
           "AVG(m.occupancy), AVG(m.energyKwh), AVG(m.waterLiters), AVG(m.openTickets)) " +
           "FROM FacilityMetric m WHERE m.facility.id = :facilityId " +
           "AND m.recordedAt >= :from AND m.recordedAt <= :to")
    MetricAverages averageBetween(@Param("facilityId") String facilityId,
                                  @Param("from") Instant from,
                                  @Param("to") Instant to);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM FacilityMetric m WHERE m.snapshot.id IN :snapshotIds")
    int deleteBySnapshotIdIn(@Param("snapshotIds") Collection<Long> snapshotIds);
}
