package com.facility.snapshot.controller;

import com.facility.common.auth.AuthScheme;
import com.facility.snapshot.dto.ExecutionSummaryResponse;
import com.facility.snapshot.dto.LatestSnapshotResponse;
import com.facility.snapshot.dto.SnapshotCountResponse;
import com.facility.snapshot.security.RequiresAuth;
import com.facility.snapshot.service.SnapshotQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/snapshots")
@RequiredArgsConstructor
@RequiresAuth({AuthScheme.BASIC, AuthScheme.API_KEY})
@Tag(name = "Snapshots", description = "Snapshot executions and their metrics")
public class SnapshotController {

    private final SnapshotQueryService queryService;

    @GetMapping
    @Operation(summary = "Recent executions", description = "Most recent snapshot executions, newest first")
    public ResponseEntity<List<ExecutionSummaryResponse>> listSnapshots() {
        return ResponseEntity.ok(queryService.recentExecutions());
    }

    @GetMapping("/count")
    @Operation(summary = "Count executions", description = "Number of executions inside the retention window")
    public ResponseEntity<SnapshotCountResponse> count() {
        return ResponseEntity.ok(queryService.countExecutions());
    }

    @GetMapping("/latest")
    @Operation(summary = "Latest snapshot", description = "Newest execution with every facility metric it produced")
    public ResponseEntity<LatestSnapshotResponse> latest() {
        return ResponseEntity.ok(queryService.latestSnapshot());
    }
}
