package com.facility.snapshot.generator;

import com.facility.snapshot.config.TelemetryProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Random;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unseeded by default. With {@code telemetry.snapshot.seed} set, the n-th run of the
 * process always draws the same values.
 */
@Component
class SeededRandomProvider implements RandomProvider {

    private final TelemetryProperties properties;
    private final AtomicLong runSequence = new AtomicLong();

    SeededRandomProvider(TelemetryProperties properties) {
        this.properties = properties;
    }

    @Override
    public Random forRun(Instant now) {
        Long seed = properties.getSnapshot().getSeed();
        if (seed == null) {
            return new Random();
        }
        return new Random(seed ^ runSequence.getAndIncrement());
    }
}
