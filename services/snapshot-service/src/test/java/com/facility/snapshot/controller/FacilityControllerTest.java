package com.facility.snapshot.controller;

import com.facility.snapshot.generator.SnapshotGenerator;
import com.facility.snapshot.repository.FacilityMetricRepository;
import com.facility.snapshot.repository.SnapshotExecutionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Random;

import static com.facility.snapshot.controller.SnapshotControllerTest.basic;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.oneOf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureTestDatabase
@AutoConfigureMockMvc
public class FacilityControllerTest {

    private static final String API_KEY = "test-api-key";
    private static final String BEARER = "Bearer bearer-token-1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SnapshotGenerator generator;

    @Autowired
    private FacilityMetricRepository metricRepository;

    @Autowired
    private SnapshotExecutionRepository executionRepository;

    @BeforeEach
    void clean() {
        metricRepository.deleteAllInBatch();
        executionRepository.deleteAllInBatch();
    }

    @Test
    void history_returnsOneRecordPerRun() throws Exception {
        generator.generate(new Random(1));
        generator.generate(new Random(2));
        generator.generate(new Random(3));

        mockMvc.perform(get("/api/v1/facilities/FAC-10/history").header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.facility_id").value("FAC-10"))
                .andExpect(jsonPath("$.records", hasSize(3)))
                .andExpect(jsonPath("$.records[0].occupancy", allOf(greaterThanOrEqualTo(4), lessThanOrEqualTo(9))));
    }

    @Test
    void history_rejectsBearer() throws Exception {
        mockMvc.perform(get("/api/v1/facilities/FAC-10/history").header("Authorization", BEARER))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void history_ofInactiveFacility_isEmpty() throws Exception {
        generator.generate(new Random(1));

        mockMvc.perform(get("/api/v1/facilities/FAC-OFF/history").header("Authorization", basic("tester", "secret")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.records", hasSize(0)));
    }

    @Test
    void aggregate_withBearer_returnsRoundedAverages() throws Exception {
        generator.generate(new Random(11));

        mockMvc.perform(get("/api/v1/facilities/FAC-3/aggregate")
                .param("from_time", "2000-01-01")
                .param("to_time", "2100-01-01T00:00:00Z")
                .header("Authorization", BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.facility_id").value("FAC-3"))
                .andExpect(jsonPath("$.averages.avg_occupancy", oneOf(1.0, 2.0)))
                .andExpect(jsonPath("$.averages.avg_open_tickets", allOf(greaterThanOrEqualTo(0.0), lessThanOrEqualTo(20.0))));
    }

    @Test
    void aggregate_overEmptyRange_returnsZeros() throws Exception {
        generator.generate(new Random(11));

        mockMvc.perform(get("/api/v1/facilities/FAC-3/aggregate")
                .param("from_time", "1990-01-01T00:00:00")
                .param("to_time", "1990-01-02T00:00:00")
                .header("X-API-Key", API_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.averages.avg_occupancy").value(0.0))
                .andExpect(jsonPath("$.averages.avg_energy_kwh").value(0.0));
    }

    @Test
    void aggregate_withInvalidTimestamp_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/facilities/FAC-3/aggregate")
                .param("from_time", "yesterday")
                .param("to_time", "2024-01-02")
                .header("X-API-Key", API_KEY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid datetime format."));
    }

    @Test
    void aggregate_withMissingParameter_returnsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/facilities/FAC-3/aggregate")
                .param("from_time", "2024-01-01")
                .header("X-API-Key", API_KEY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0]").value("to_time: is required"));
    }

    @Test
    void aggregate_withoutCredentials_isUnauthorizedBeforeValidation() throws Exception {
        mockMvc.perform(get("/api/v1/facilities/FAC-3/aggregate").param("from_time", "bad"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void v2Metrics_groupsLatestFacilityMetric() throws Exception {
        generator.generate(new Random(5));
        Long latest = executionRepository.findFirstByOrderByExecutionTimeDescIdDesc().orElseThrow().getId();

        mockMvc.perform(get("/api/v2/facilities/FAC-100/metrics").header("Authorization", BEARER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("v2"))
                .andExpect(jsonPath("$.metadata.snapshot_id").value(latest))
                .andExpect(jsonPath("$.operational.occupancy", allOf(greaterThanOrEqualTo(40), lessThanOrEqualTo(90))))
                .andExpect(jsonPath("$.operational.hvac_status", oneOf("healthy", "warning", "critical")))
                .andExpect(jsonPath("$.utilities.energy_per_person").isNumber());
    }

    @Test
    void v2Metrics_forUnknownFacility_returnsNotFound() throws Exception {
        generator.generate(new Random(5));

        mockMvc.perform(get("/api/v2/facilities/FAC-404/metrics").header("X-API-Key", API_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Facility not found"));
    }

    @Test
    void v2Metrics_withoutSnapshots_returnsNotFound() throws Exception {
        mockMvc.perform(get("/api/v2/facilities/FAC-100/metrics").header("X-API-Key", API_KEY))
                .andExpect(status().isNotFound());
    }
}
