package com.facility.snapshot.controller;

import com.facility.common.auth.AuthScheme;
import com.facility.snapshot.dto.FacilityAggregateResponse;
import com.facility.snapshot.dto.FacilityHistoryResponse;
import com.facility.snapshot.security.RequiresAuth;
import com.facility.snapshot.service.SnapshotQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/facilities")
@RequiredArgsConstructor
@Tag(name = "Facilities v1", description = "Per-facility metric history and aggregates")
public class FacilityController {

    private final SnapshotQueryService queryService;

    @GetMapping("/{facilityId}/history")
    @RequiresAuth({AuthScheme.BASIC, AuthScheme.API_KEY})
    @Operation(summary = "Facility history", description = "Most recent metrics of a facility by recorded time")
    public ResponseEntity<FacilityHistoryResponse> history(@PathVariable String facilityId) {
        return ResponseEntity.ok(queryService.facilityHistory(facilityId));
    }

    /**
     * GET /api/v1/facilities/{id}/aggregate?from_time=2024-01-01T00:00:00&to_time=2024-01-02T00:00:00
     */
    @GetMapping("/{facilityId}/aggregate")
    @RequiresAuth({AuthScheme.BASIC, AuthScheme.API_KEY, AuthScheme.BEARER})
    @Operation(summary = "Facility aggregate", description = "Average metrics over an inclusive time range")
    public ResponseEntity<FacilityAggregateResponse> aggregate(
            @PathVariable String facilityId,
            @RequestParam("from_time") String fromTime,
            @RequestParam("to_time") String toTime) {
        return ResponseEntity.ok(queryService.facilityAggregate(facilityId, fromTime, toTime));
    }
}
