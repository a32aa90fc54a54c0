package com.facility.snapshot.dto;

import com.facility.snapshot.model.ExecutionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record LatestSnapshotResponse(
    @JsonProperty("version")
    String version,

    @JsonProperty("snapshot_id")
    Long snapshotId,

    @JsonProperty("execution_time")
    Instant executionTime,

    @JsonProperty("status")
    ExecutionStatus status,

    @JsonProperty("facilities")
    List<FacilityMetricResponse> facilities
) {
}
