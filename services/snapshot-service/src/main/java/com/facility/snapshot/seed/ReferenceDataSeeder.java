package com.facility.snapshot.seed;

import com.facility.snapshot.config.TelemetryProperties;
import com.facility.snapshot.model.Facility;
import com.facility.snapshot.model.HvacStatus;
import com.facility.snapshot.repository.FacilityRepository;
import com.facility.snapshot.repository.HvacStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Seeds HVAC statuses and the configured facilities into empty tables on startup.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReferenceDataSeeder implements ApplicationRunner {

    static final List<HvacStatus> DEFAULT_HVAC_STATUSES = List.of(
            HvacStatus.builder().code("healthy").description("Normal").build(),
            HvacStatus.builder().code("warning").description("Attention required").build(),
            HvacStatus.builder().code("critical").description("Immediate action").build()
    );

    private final HvacStatusRepository hvacStatusRepository;
    private final FacilityRepository facilityRepository;
    private final TelemetryProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (hvacStatusRepository.count() == 0) {
            for (HvacStatus status : DEFAULT_HVAC_STATUSES) {
                hvacStatusRepository.save(HvacStatus.builder()
                        .code(status.getCode())
                        .description(status.getDescription())
                        .build());
            }
            log.info("Seeded {} HVAC statuses", DEFAULT_HVAC_STATUSES.size());
        }

        if (facilityRepository.count() == 0) {
            List<Facility> facilities = properties.getFacilities().stream()
                    .map(seed -> Facility.builder()
                            .id(seed.getId())
                            .name(seed.getName())
                            .city(seed.getCity())
                            .capacity(seed.getCapacity())
                            .active(seed.isActive())
                            .build())
                    .toList();
            facilityRepository.saveAll(facilities);
            log.info("Seeded {} facilities", facilities.size());
        }
    }
}
