package com.facility.snapshot.store;

import com.facility.snapshot.exception.StorageException;
import com.facility.snapshot.model.ExecutionStatus;
import com.facility.snapshot.model.Facility;
import com.facility.snapshot.model.FacilityMetric;
import com.facility.snapshot.model.HvacStatus;
import com.facility.snapshot.model.SnapshotExecution;
import com.facility.snapshot.repository.FacilityMetricRepository;
import com.facility.snapshot.repository.FacilityRepository;
import com.facility.snapshot.repository.HvacStatusRepository;
import com.facility.snapshot.repository.SnapshotExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Transactional writes for the snapshot job: executions, their metrics and retention.
 *
 * <p>Every public method runs in its own transaction when called through the Spring proxy.
 * Spring data access failures surface as {@link StorageException}. Metrics are never
 * cascaded; retention deletes them explicitly before their execution.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetricStore {

    private final SnapshotExecutionRepository executionRepository;
    private final FacilityMetricRepository metricRepository;
    private final FacilityRepository facilityRepository;
    private final HvacStatusRepository hvacStatusRepository;
    private final Clock clock;

    @Transactional
    public ExecutionHandle createExecution() {
        try {
            SnapshotExecution execution = executionRepository.saveAndFlush(SnapshotExecution.builder()
                    .executionTime(clock.instant())
                    .status(ExecutionStatus.RUNNING)
                    .build());
            log.debug("Created snapshot execution {}", execution.getId());
            return new ExecutionHandle(execution.getId(), execution.getExecutionTime());
        } catch (DataAccessException e) {
            throw new StorageException("Could not create snapshot execution", e);
        }
    }

    @Transactional(readOnly = true)
    public List<Facility> loadActiveFacilities() {
        try {
            return facilityRepository.findByActiveTrueOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new StorageException("Could not load active facilities", e);
        }
    }

    @Transactional(readOnly = true)
    public List<HvacStatus> loadHvacStatuses() {
        try {
            return hvacStatusRepository.findAllByOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new StorageException("Could not load HVAC statuses", e);
        }
    }

    /**
     * Inserts one metric row.
     *
     * @throws StorageException if the execution, facility or HVAC status does not exist
     */
    @Transactional
    public FacilityMetric recordMetric(Long executionId, MetricSample sample) {
        SnapshotExecution execution = executionRepository.findById(executionId)
                .orElseThrow(() -> new StorageException("Unknown snapshot execution: " + executionId));
        Facility facility = facilityRepository.findById(sample.facilityId())
                .orElseThrow(() -> new StorageException("Unknown facility: " + sample.facilityId()));
        HvacStatus hvacStatus = hvacStatusRepository.findById(sample.hvacStatusId())
                .orElseThrow(() -> new StorageException("Unknown HVAC status: " + sample.hvacStatusId()));

        try {
            return metricRepository.save(FacilityMetric.builder()
                    .snapshot(execution)
                    .facility(facility)
                    .hvacStatus(hvacStatus)
                    .occupancy(sample.occupancy())
                    .energyKwh(sample.energyKwh())
                    .waterLiters(sample.waterLiters())
                    .openTickets(sample.openTickets())
                    .recordedAt(sample.recordedAt())
                    .build());
        } catch (DataAccessException e) {
            throw new StorageException("Could not record metric for facility " + sample.facilityId(), e);
        }
    }

    /**
     * Moves a running execution to its terminal status. Expected to be called once per execution.
     */
    @Transactional
    public void finalizeExecution(Long executionId, ExecutionStatus status, long durationMs) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Execution can only be finalized as success or failed");
        }
        try {
            SnapshotExecution execution = executionRepository.findById(executionId)
                    .orElseThrow(() -> new StorageException("Unknown snapshot execution: " + executionId));
            execution.setStatus(status);
            execution.setExecutionDurationMs(durationMs);
            executionRepository.saveAndFlush(execution);
        } catch (DataAccessException e) {
            throw new StorageException("Could not finalize snapshot execution " + executionId, e);
        }
    }

    /**
     * Records every sample and marks the execution successful in a single transaction.
     * The first failing insert aborts the remaining samples and rolls back the ones
     * already written, leaving the execution running for the caller to fail.
     *
     * @param durationMs evaluated after the inserts, just before finalizing
     */
    @Transactional
    public int commitSnapshot(Long executionId, List<MetricSample> samples, LongSupplier durationMs) {
        for (MetricSample sample : samples) {
            recordMetric(executionId, sample);
        }
        try {
            metricRepository.flush();
        } catch (DataAccessException e) {
            throw new StorageException("Could not write metrics for snapshot execution " + executionId, e);
        }
        finalizeExecution(executionId, ExecutionStatus.SUCCESS, durationMs.getAsLong());
        return samples.size();
    }

    /**
     * Keeps the {@code limit} newest executions, ordered by (execution_time desc, id desc),
     * and deletes everything older together with its metrics.
     *
     * <p>The window is read inside this transaction and the purge is bounded by the oldest
     * kept row rather than a count, so an execution created concurrently is newer than the
     * boundary and always survives.
     *
     * @return number of executions purged
     */
    @Transactional
    public int enforceRetention(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Retention limit must be positive: " + limit);
        }
        try {
            List<SnapshotExecution> window =
                    executionRepository.findAllByOrderByExecutionTimeDescIdDesc(PageRequest.of(0, limit));
            if (window.size() < limit) {
                return 0;
            }

            SnapshotExecution boundary = window.get(window.size() - 1);
            List<Long> expired = executionRepository.findIdsOlderThan(boundary.getExecutionTime(), boundary.getId());
            if (expired.isEmpty()) {
                return 0;
            }

            int metrics = metricRepository.deleteBySnapshotIdIn(expired);
            int executions = executionRepository.deleteByIdIn(expired);
            log.info("Retention purged {} executions and {} metrics (limit={})", executions, metrics, limit);
            return executions;
        } catch (DataAccessException e) {
            throw new StorageException("Retention pass failed", e);
        }
    }
}
