package com.facility.snapshot.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One run of the snapshot job. Deleted only by retention, after its metrics.
 */
@Entity
@Table(name = "snapshot_executions", indexes = {
    @Index(name = "idx_execution_time", columnList = "execution_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "execution_time", nullable = false)
    private Instant executionTime;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Column(name = "execution_duration_ms")
    private Long executionDurationMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
