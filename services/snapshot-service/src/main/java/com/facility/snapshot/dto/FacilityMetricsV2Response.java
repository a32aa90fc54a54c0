package com.facility.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * v2 view of a facility's latest metric, grouped by concern.
 */
public record FacilityMetricsV2Response(
    @JsonProperty("version")
    String version,

    @JsonProperty("metadata")
    Metadata metadata,

    @JsonProperty("operational")
    Operational operational,

    @JsonProperty("utilities")
    Utilities utilities
) {
    public record Metadata(
        @JsonProperty("snapshot_id")
        Long snapshotId,

        @JsonProperty("execution_time")
        Instant executionTime
    ) {
    }

    public record Operational(
        @JsonProperty("occupancy")
        int occupancy,

        @JsonProperty("open_tickets")
        int openTickets,

        @JsonProperty("hvac_status")
        String hvacStatus
    ) {
    }

    public record Utilities(
        @JsonProperty("energy_kwh")
        double energyKwh,

        @JsonProperty("water_liters")
        double waterLiters,

        @JsonProperty("energy_per_person")
        double energyPerPerson
    ) {
    }
}
