package com.facility.snapshot.dto;

import com.facility.snapshot.model.FacilityMetric;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One facility's row inside the latest snapshot.
 */
public record FacilityMetricResponse(
    @JsonProperty("facility_id")
    String facilityId,

    @JsonProperty("occupancy")
    int occupancy,

    @JsonProperty("energy_kwh")
    double energyKwh,

    @JsonProperty("water_liters")
    double waterLiters,

    @JsonProperty("open_tickets")
    int openTickets,

    @JsonProperty("hvac_status")
    String hvacStatus,

    @JsonProperty("recorded_at")
    Instant recordedAt
) {
    public static FacilityMetricResponse fromEntity(FacilityMetric metric) {
        return new FacilityMetricResponse(
            metric.getFacility().getId(),
            metric.getOccupancy(),
            metric.getEnergyKwh(),
            metric.getWaterLiters(),
            metric.getOpenTickets(),
            metric.getHvacStatus().getCode(),
            metric.getRecordedAt()
        );
    }
}
