package com.facility.snapshot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Metrics of one facility within one snapshot. Immutable once written.
 */
@Entity
@Table(name = "facility_metrics", indexes = {
    @Index(name = "idx_facility_snapshot", columnList = "facility_id, snapshot_id"),
    @Index(name = "idx_facility_recorded", columnList = "facility_id, recorded_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FacilityMetric {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "snapshot_id", nullable = false)
    private SnapshotExecution snapshot;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "facility_id", nullable = false)
    private Facility facility;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "hvac_status_id", nullable = false)
    private HvacStatus hvacStatus;

    @Column(nullable = false)
    private int occupancy;

    @Column(name = "energy_kwh", nullable = false)
    private double energyKwh;

    @Column(name = "water_liters", nullable = false)
    private double waterLiters;

    @Column(name = "open_tickets", nullable = false)
    private int openTickets;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
