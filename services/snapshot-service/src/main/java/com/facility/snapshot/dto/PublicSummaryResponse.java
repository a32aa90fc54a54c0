package com.facility.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PublicSummaryResponse(
    @JsonProperty("service")
    String service,

    @JsonProperty("total_snapshots")
    long totalSnapshots,

    @JsonProperty("total_records")
    long totalRecords
) {
}
