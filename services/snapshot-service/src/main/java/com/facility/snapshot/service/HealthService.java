package com.facility.snapshot.service;

import com.facility.snapshot.config.TelemetryProperties;
import com.facility.snapshot.dto.HealthResponse;
import com.facility.snapshot.job.SnapshotJobController;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class HealthService {

    private final JdbcTemplate jdbcTemplate;
    private final SnapshotJobController jobController;
    private final TelemetryProperties properties;

    public HealthResponse check() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return HealthResponse.unhealthy(properties.getServiceName(), "database unavailable");
        }
        return HealthResponse.healthy(properties.getServiceName(), jobController.status().schedulerRunning());
    }
}
