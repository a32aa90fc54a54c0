package com.facility.snapshot.controller;

import com.facility.snapshot.dto.HealthResponse;
import com.facility.snapshot.dto.PublicSummaryResponse;
import com.facility.snapshot.service.HealthService;
import com.facility.snapshot.service.SnapshotQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated endpoints.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Public", description = "Health and public summary")
public class PublicController {

    private final HealthService healthService;
    private final SnapshotQueryService queryService;

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Database connectivity and scheduler state")
    public ResponseEntity<HealthResponse> health() {
        HealthResponse health = healthService.check();
        HttpStatus status = health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(status).body(health);
    }

    @GetMapping("/api/v1/public/summary")
    @Operation(summary = "Public summary", description = "Total snapshots and metric records")
    public ResponseEntity<PublicSummaryResponse> summary() {
        return ResponseEntity.ok(queryService.publicSummary());
    }
}
