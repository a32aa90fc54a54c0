package com.facility.snapshot.dto;

import com.facility.snapshot.model.FacilityMetric;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record FacilityHistoryResponse(
    @JsonProperty("facility_id")
    String facilityId,

    @JsonProperty("records")
    List<HistoryRecord> records
) {
    public record HistoryRecord(
        @JsonProperty("snapshot_id")
        Long snapshotId,

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
        public static HistoryRecord fromEntity(FacilityMetric metric) {
            return new HistoryRecord(
                metric.getSnapshot().getId(),
                metric.getOccupancy(),
                metric.getEnergyKwh(),
                metric.getWaterLiters(),
                metric.getOpenTickets(),
                metric.getHvacStatus().getCode(),
                metric.getRecordedAt()
            );
        }
    }
}
