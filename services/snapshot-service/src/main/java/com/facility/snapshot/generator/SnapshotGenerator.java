package com.facility.snapshot.generator;

import com.facility.snapshot.config.TelemetryProperties;
import com.facility.snapshot.exception.ConfigurationException;
import com.facility.snapshot.model.ExecutionStatus;
import com.facility.snapshot.model.Facility;
import com.facility.snapshot.model.HvacStatus;
import com.facility.snapshot.store.ExecutionHandle;
import com.facility.snapshot.store.MetricSample;
import com.facility.snapshot.store.MetricStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Produces one snapshot: a running execution, one metric per active facility, then
 * success and a retention pass. Any failure marks the execution failed and is returned
 * as a {@link SnapshotResult}; nothing escapes to the timer.
 */
@Service
@Slf4j
public class SnapshotGenerator {

    private final MetricStore metricStore;
    private final MetricSampler sampler;
    private final RandomProvider randomProvider;
    private final TelemetryProperties properties;
    private final Clock clock;

    private final Counter runsSucceeded;
    private final Counter runsFailed;
    private final Counter executionsPurged;
    private final Timer generationLatency;

    public SnapshotGenerator(
            MetricStore metricStore,
            MetricSampler sampler,
            RandomProvider randomProvider,
            TelemetryProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.metricStore = metricStore;
        this.sampler = sampler;
        this.randomProvider = randomProvider;
        this.properties = properties;
        this.clock = clock;

        this.runsSucceeded = Counter.builder("snapshot.runs.succeeded")
                .description("Snapshot runs finalized as success")
                .register(meterRegistry);

        this.runsFailed = Counter.builder("snapshot.runs.failed")
                .description("Snapshot runs finalized as failed")
                .register(meterRegistry);

        this.executionsPurged = Counter.builder("snapshot.retention.purged")
                .description("Executions deleted by the retention window")
                .register(meterRegistry);

        this.generationLatency = Timer.builder("snapshot.generation.latency")
                .description("Time taken to write a successful snapshot")
                .register(meterRegistry);
    }

    public SnapshotResult generate() {
        return generate(randomProvider.forRun(clock.instant()));
    }

    public SnapshotResult generate(Random random) {
        long startNanos = System.nanoTime();

        ExecutionHandle execution;
        try {
            execution = metricStore.createExecution();
        } catch (RuntimeException e) {
            log.error("Could not create snapshot execution: {}", e.getMessage(), e);
            runsFailed.increment();
            return SnapshotResult.failed(null, elapsedMs(startNanos), e.getMessage());
        }

        int written;
        try {
            List<Facility> facilities = metricStore.loadActiveFacilities();
            List<HvacStatus> statuses = metricStore.loadHvacStatuses();
            if (statuses.isEmpty()) {
                throw new ConfigurationException("No HVAC statuses configured");
            }

            Instant recordedAt = clock.instant();
            List<MetricSample> samples = new ArrayList<>(facilities.size());
            for (Facility facility : facilities) {
                samples.add(sampler.sample(facility, statuses, random, recordedAt));
            }
            written = metricStore.commitSnapshot(execution.id(), samples, () -> elapsedMs(startNanos));
        } catch (ConfigurationException e) {
            log.warn("Snapshot execution {} failed: {}", execution.id(), e.getMessage());
            return fail(execution, startNanos, e);
        } catch (RuntimeException e) {
            log.error("Snapshot execution {} failed: {}", execution.id(), e.getMessage(), e);
            return fail(execution, startNanos, e);
        }

        long durationMs = elapsedMs(startNanos);
        runsSucceeded.increment();
        generationLatency.record(durationMs, TimeUnit.MILLISECONDS);

        int purged = applyRetention();
        log.debug("Snapshot execution {} succeeded: metrics={}, purged={}, durationMs={}",
                execution.id(), written, purged, durationMs);
        return SnapshotResult.success(execution.id(), written, purged, durationMs);
    }

    private int applyRetention() {
        try {
            int purged = metricStore.enforceRetention(properties.getSnapshot().getRetentionLimit());
            executionsPurged.increment(purged);
            return purged;
        } catch (RuntimeException e) {
            // next successful run retries the purge
            log.warn("Retention pass failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private SnapshotResult fail(ExecutionHandle execution, long startNanos, RuntimeException cause) {
        long durationMs = elapsedMs(startNanos);
        runsFailed.increment();
        try {
            metricStore.finalizeExecution(execution.id(), ExecutionStatus.FAILED, durationMs);
        } catch (RuntimeException e) {
            log.error("Could not mark snapshot execution {} as failed: {}", execution.id(), e.getMessage(), e);
        }
        return SnapshotResult.failed(execution.id(), durationMs, cause.getMessage());
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
