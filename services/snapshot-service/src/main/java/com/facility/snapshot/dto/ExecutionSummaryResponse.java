package com.facility.snapshot.dto;

import com.facility.snapshot.model.ExecutionStatus;
import com.facility.snapshot.model.SnapshotExecution;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ExecutionSummaryResponse(
    @JsonProperty("snapshot_id")
    Long snapshotId,

    @JsonProperty("execution_time")
    Instant executionTime,

    @JsonProperty("status")
    ExecutionStatus status,

    @JsonProperty("duration_ms")
    Long durationMs
) {
    public static ExecutionSummaryResponse fromEntity(SnapshotExecution execution) {
        return new ExecutionSummaryResponse(
            execution.getId(),
            execution.getExecutionTime(),
            execution.getStatus(),
            execution.getExecutionDurationMs()
        );
    }
}
