package com.facility.snapshot.generator;

import java.time.Instant;
import java.util.Random;

/**
 * Supplies the random source for one snapshot run.
 */
public interface RandomProvider {
    Random forRun(Instant now);
}
