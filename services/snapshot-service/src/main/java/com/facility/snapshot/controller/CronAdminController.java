package com.facility.snapshot.controller;

import com.facility.snapshot.dto.JobCommandResponse;
import com.facility.snapshot.job.JobStatus;
import com.facility.snapshot.job.SnapshotJobController;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Control surface of the snapshot job. Every call returns at once, even while a
 * snapshot is being written.
 */
@RestController
@RequestMapping("/admin/cron")
@RequiredArgsConstructor
@Tag(name = "Job Admin", description = "Start, pause, resume and stop the snapshot job")
public class CronAdminController {

    private final SnapshotJobController jobController;

    @PostMapping("/start")
    @Operation(summary = "Start the snapshot job")
    public ResponseEntity<JobCommandResponse> start() {
        return ResponseEntity.ok(new JobCommandResponse(jobController.start()));
    }

    @PostMapping("/pause")
    @Operation(summary = "Pause the snapshot job")
    public ResponseEntity<JobCommandResponse> pause() {
        return ResponseEntity.ok(new JobCommandResponse(jobController.pause()));
    }

    @PostMapping("/resume")
    @Operation(summary = "Resume the snapshot job")
    public ResponseEntity<JobCommandResponse> resume() {
        return ResponseEntity.ok(new JobCommandResponse(jobController.resume()));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the snapshot job", description = "A run in progress completes normally")
    public ResponseEntity<JobCommandResponse> stop() {
        return ResponseEntity.ok(new JobCommandResponse(jobController.stop()));
    }

    @GetMapping("/status")
    @Operation(summary = "Snapshot job status")
    public ResponseEntity<JobStatus> status() {
        return ResponseEntity.ok(jobController.status());
    }
}
