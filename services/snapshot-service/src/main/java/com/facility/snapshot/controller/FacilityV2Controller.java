package com.facility.snapshot.controller;

import com.facility.common.auth.AuthScheme;
import com.facility.snapshot.dto.FacilityMetricsV2Response;
import com.facility.snapshot.security.RequiresAuth;
import com.facility.snapshot.service.SnapshotQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v2/facilities")
@RequiredArgsConstructor
@Tag(name = "Facilities v2", description = "Grouped facility metrics")
public class FacilityV2Controller {

    private final SnapshotQueryService queryService;

    @GetMapping("/{facilityId}/metrics")
    @RequiresAuth({AuthScheme.BASIC, AuthScheme.API_KEY, AuthScheme.BEARER})
    @Operation(summary = "Latest facility metrics", description = "Facility metrics from the newest snapshot")
    public ResponseEntity<FacilityMetricsV2Response> metrics(@PathVariable String facilityId) {
        return ResponseEntity.ok(queryService.facilityMetricsV2(facilityId));
    }
}
