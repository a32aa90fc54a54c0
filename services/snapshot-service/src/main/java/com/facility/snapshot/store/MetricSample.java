package com.facility.snapshot.store;

import java.time.Instant;

/**
 * Synthesized values for one facility, not yet persisted.
 */
public record MetricSample(
    String facilityId,
    Integer hvacStatusId,
    int occupancy,
    double energyKwh,
    double waterLiters,
    int openTickets,
    Instant recordedAt
) {
}
