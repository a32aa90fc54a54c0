package com.facility.snapshot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Averages over an inclusive time range. Empty ranges report zeros.
 */
public record FacilityAggregateResponse(
    @JsonProperty("facility_id")
    String facilityId,

    @JsonProperty("from_time")
    Instant fromTime,

    @JsonProperty("to_time")
    Instant toTime,

    @JsonProperty("averages")
    Averages averages
) {
    public record Averages(
        @JsonProperty("avg_occupancy")
        double occupancy,

        @JsonProperty("avg_energy_kwh")
        double energyKwh,

        @JsonProperty("avg_water_liters")
        double waterLiters,

        @JsonProperty("avg_open_tickets")
        double openTickets
    ) {
    }
}
