package com.facility.snapshot.service;

import com.facility.snapshot.config.TelemetryProperties;
import com.facility.snapshot.dto.ExecutionSummaryResponse;
import com.facility.snapshot.dto.FacilityAggregateResponse;
import com.facility.snapshot.dto.FacilityHistoryResponse;
import com.facility.snapshot.dto.FacilityMetricResponse;
import com.facility.snapshot.dto.FacilityMetricsV2Response;
import com.facility.snapshot.dto.LatestSnapshotResponse;
import com.facility.snapshot.dto.PublicSummaryResponse;
import com.facility.snapshot.dto.SnapshotCountResponse;
import com.facility.snapshot.exception.InvalidRequestException;
import com.facility.snapshot.exception.ResourceNotFoundException;
import com.facility.snapshot.model.FacilityMetric;
import com.facility.snapshot.model.SnapshotExecution;
import com.facility.snapshot.repository.FacilityMetricRepository;
import com.facility.snapshot.repository.MetricAverages;
import com.facility.snapshot.repository.SnapshotExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Read side of the metric store behind the v1/v2 API.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotQueryService {

    static final String NO_DATA = "No data available";

    // yyyy-MM-dd
    private static final int DATE_LENGTH = 10;

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private final SnapshotExecutionRepository executionRepository;
    private final FacilityMetricRepository metricRepository;
    private final TelemetryProperties properties;

    @Transactional(readOnly = true)
    public SnapshotCountResponse countExecutions() {
        return new SnapshotCountResponse(executionRepository.count());
    }

    @Transactional(readOnly = true)
    public PublicSummaryResponse publicSummary() {
        return new PublicSummaryResponse(
                properties.getServiceName(),
                executionRepository.count(),
                metricRepository.count());
    }

    @Transactional(readOnly = true)
    public List<ExecutionSummaryResponse> recentExecutions() {
        int limit = properties.getApi().getRecentExecutionsLimit();
        return executionRepository.findAllByOrderByExecutionTimeDescIdDesc(PageRequest.of(0, limit)).stream()
                .map(ExecutionSummaryResponse::fromEntity)
                .toList();
    }

    @Transactional(readOnly = true)
    public LatestSnapshotResponse latestSnapshot() {
        SnapshotExecution latest = latestExecution();
        List<FacilityMetricResponse> facilities = metricRepository.findBySnapshotId(latest.getId()).stream()
                .map(FacilityMetricResponse::fromEntity)
                .toList();
        return new LatestSnapshotResponse("v1", latest.getId(), latest.getExecutionTime(), latest.getStatus(), facilities);
    }

    @Transactional(readOnly = true)
    public FacilityHistoryResponse facilityHistory(String facilityId) {
        int limit = properties.getApi().getHistoryLimit();
        List<FacilityHistoryResponse.HistoryRecord> records =
                metricRepository.findHistory(facilityId, PageRequest.of(0, limit)).stream()
                        .map(FacilityHistoryResponse.HistoryRecord::fromEntity)
                        .toList();
        return new FacilityHistoryResponse(facilityId, records);
    }

    /**
     * Averages over {@code [from, to]} inclusive.
     *
     * @throws InvalidRequestException if either bound is not an ISO-8601 date or date-time
     */
    @Transactional(readOnly = true)
    public FacilityAggregateResponse facilityAggregate(String facilityId, String from, String to) {
        Instant fromTime = parseTimestamp(from);
        Instant toTime = parseTimestamp(to);
        log.debug("Aggregating facility {} between {} and {}", facilityId, fromTime, toTime);

        MetricAverages averages = metricRepository.averageBetween(facilityId, fromTime, toTime);
        return new FacilityAggregateResponse(facilityId, fromTime, toTime, new FacilityAggregateResponse.Averages(
                round2(averages.occupancy()),
                round2(averages.energyKwh()),
                round2(averages.waterLiters()),
                round2(averages.openTickets())));
    }

    @Transactional(readOnly = true)
    public FacilityMetricsV2Response facilityMetricsV2(String facilityId) {
        SnapshotExecution latest = latestExecution();
        FacilityMetric metric = metricRepository.findBySnapshotIdAndFacilityId(latest.getId(), facilityId)
                .orElseThrow(() -> new ResourceNotFoundException("Facility not found"));

        double energyPerPerson = metric.getOccupancy() == 0
                ? 0.0
                : round2(metric.getEnergyKwh() / metric.getOccupancy());

        return new FacilityMetricsV2Response(
                "v2",
                new FacilityMetricsV2Response.Metadata(latest.getId(), latest.getExecutionTime()),
                new FacilityMetricsV2Response.Operational(
                        metric.getOccupancy(), metric.getOpenTickets(), metric.getHvacStatus().getCode()),
                new FacilityMetricsV2Response.Utilities(
                        metric.getEnergyKwh(), metric.getWaterLiters(), energyPerPerson));
    }

    private SnapshotExecution latestExecution() {
        return executionRepository.findFirstByOrderByExecutionTimeDescIdDesc()
                .orElseThrow(() -> new ResourceNotFoundException(NO_DATA));
    }

    /**
     * Accepts an offset date-time, a local date-time (read as UTC) or a bare date (UTC midnight).
     * Date and time may be separated by {@code T} or a single space.
     */
    static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Invalid datetime format.");
        }
        String text = value.trim();
        if (text.length() > DATE_LENGTH && text.charAt(DATE_LENGTH) == ' ') {
            text = text.substring(0, DATE_LENGTH) + 'T' + text.substring(DATE_LENGTH + 1);
        }
        try {
            TemporalAccessor parsed = TIMESTAMP_FORMAT.parseBest(text,
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            if (parsed instanceof LocalDateTime localDateTime) {
                return localDateTime.toInstant(ZoneOffset.UTC);
            }
            return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new InvalidRequestException("Invalid datetime format.");
        }
    }

    static double round2(Double value) {
        if (value == null) {
            return 0.0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
