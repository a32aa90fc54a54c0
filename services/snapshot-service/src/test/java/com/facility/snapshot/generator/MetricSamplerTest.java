package com.facility.snapshot.generator;

import com.facility.snapshot.model.Facility;
import com.facility.snapshot.model.HvacStatus;
import com.facility.snapshot.store.MetricSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MetricSamplerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");
    private static final List<HvacStatus> STATUSES = List.of(
            HvacStatus.builder().id(1).code("healthy").build(),
            HvacStatus.builder().id(2).code("warning").build(),
            HvacStatus.builder().id(3).code("critical").build());

    private final MetricSampler sampler = new MetricSampler();

    private static Facility facility(String id, int capacity) {
        return Facility.builder().id(id).name(id).city("Test").capacity(capacity).build();
    }

    @ParameterizedTest
    @CsvSource({
        "10, 4, 9",
        "100, 40, 90",
        "3, 1, 2",
        "1, 0, 0",
        "2, 0, 1",
        "7, 2, 6"
    })
    void occupancyBounds_useFloor(int capacity, int expectedMin, int expectedMax) {
        assertThat(MetricSampler.minOccupancy(capacity)).isEqualTo(expectedMin);
        assertThat(MetricSampler.maxOccupancy(capacity)).isEqualTo(expectedMax);
    }

    @Test
    void samples_stayWithinDocumentedRanges() {
        Random random = new Random(7);
        Facility facility = facility("FAC-100", 100);

        for (int i = 0; i < 2_000; i++) {
            MetricSample sample = sampler.sample(facility, STATUSES, random, NOW);

            assertThat(sample.occupancy()).isBetween(40, 90);
            assertThat(sample.energyKwh()).isGreaterThanOrEqualTo(10_000).isLessThan(30_000);
            assertThat(sample.waterLiters()).isGreaterThanOrEqualTo(20_000).isLessThan(60_000);
            assertThat(sample.openTickets()).isBetween(0, 20);
            assertThat(sample.hvacStatusId()).isIn(1, 2, 3);
            assertThat(sample.recordedAt()).isEqualTo(NOW);
            assertThat(sample.facilityId()).isEqualTo("FAC-100");
        }
    }

    @Test
    void occupancy_reachesBothInclusiveBounds() {
        Random random = new Random(11);
        Facility facility = facility("FAC-10", 10);
        Set<Integer> seen = new HashSet<>();

        for (int i = 0; i < 1_000; i++) {
            seen.add(sampler.sample(facility, STATUSES, random, NOW).occupancy());
        }

        assertThat(seen).containsExactlyInAnyOrder(4, 5, 6, 7, 8, 9);
    }

    @Test
    void sameSeed_producesSameSample() {
        Facility facility = facility("FAC-3", 3);

        MetricSample first = sampler.sample(facility, STATUSES, new Random(42), NOW);
        MetricSample second = sampler.sample(facility, STATUSES, new Random(42), NOW);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void emptyStatusSet_isRejected() {
        assertThatThrownBy(() -> sampler.sample(facility("FAC-10", 10), List.of(), new Random(), NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
