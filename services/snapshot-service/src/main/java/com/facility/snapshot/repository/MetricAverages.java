package com.facility.snapshot.repository;

/**
 * Raw averages over a facility's metrics; a component is null when no row matched.
 */
public record MetricAverages(Double occupancy, Double energyKwh, Double waterLiters, Double openTickets) {
}
