package com.facility.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SnapshotCountResponse(
    @JsonProperty("total_executions")
    long totalExecutions
) {
}
