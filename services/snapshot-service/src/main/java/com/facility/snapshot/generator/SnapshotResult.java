package com.facility.snapshot.generator;

import com.facility.snapshot.model.ExecutionStatus;

/**
 * Outcome of one generation attempt. Failures are reported here, never thrown.
 *
 * @param executionId null when the execution row itself could not be created
 * @param error       failure message, null on success
 */
public record SnapshotResult(
    Long executionId,
    ExecutionStatus status,
    int metricCount,
    int purgedCount,
    long durationMs,
    String error
) {
    public static SnapshotResult success(Long executionId, int metricCount, int purgedCount, long durationMs) {
        return new SnapshotResult(executionId, ExecutionStatus.SUCCESS, metricCount, purgedCount, durationMs, null);
    }

    public static SnapshotResult failed(Long executionId, long durationMs, String error) {
        return new SnapshotResult(executionId, ExecutionStatus.FAILED, 0, 0, durationMs, error);
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
