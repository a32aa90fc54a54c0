package com.facility.snapshot.store;

import java.time.Instant;

/**
 * Identifies a freshly created, running snapshot execution.
 */
public record ExecutionHandle(Long id, Instant executionTime) {
}
