package com.facility.snapshot.generator;

import com.facility.snapshot.model.Facility;
import com.facility.snapshot.model.HvacStatus;
import com.facility.snapshot.store.MetricSample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Random;

/**
 * Synthesizes the metric values of one facility.
 *
 * <ul>
 *   <li>occupancy: uniform integer in [floor(0.4 * capacity), floor(0.9 * capacity)]</li>
 *   <li>energy: uniform in [10000, 30000) kWh</li>
 *   <li>water: uniform in [20000, 60000) liters</li>
 *   <li>open tickets: uniform integer in [0, 20]</li>
 *   <li>HVAC status: uniform pick from the reference set</li>
 * </ul>
 */
@Component
public class MetricSampler {

    static final double ENERGY_MIN_KWH = 10_000;
    static final double ENERGY_MAX_KWH = 30_000;
    static final double WATER_MIN_LITERS = 20_000;
    static final double WATER_MAX_LITERS = 60_000;
    static final int MAX_OPEN_TICKETS = 20;

    public static int minOccupancy(int capacity) {
        return (int) (capacity * 4L / 10);
    }

    public static int maxOccupancy(int capacity) {
        return (int) (capacity * 9L / 10);
    }

    /**
     * @param statuses must not be empty
     */
    public MetricSample sample(Facility facility, List<HvacStatus> statuses, Random random, Instant recordedAt) {
        if (statuses.isEmpty()) {
            throw new IllegalArgumentException("HVAC status set must not be empty");
        }
        int min = minOccupancy(facility.getCapacity());
        int max = maxOccupancy(facility.getCapacity());
        HvacStatus hvacStatus = statuses.get(random.nextInt(statuses.size()));

        return new MetricSample(
                facility.getId(),
                hvacStatus.getId(),
                min + random.nextInt(max - min + 1),
                uniform(random, ENERGY_MIN_KWH, ENERGY_MAX_KWH),
                uniform(random, WATER_MIN_LITERS, WATER_MAX_LITERS),
                random.nextInt(MAX_OPEN_TICKETS + 1),
                recordedAt
        );
    }

    private static double uniform(Random random, double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
