package com.facility.snapshot.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a snapshot execution. {@code RUNNING} moves exactly once to a terminal state.
 */
public enum ExecutionStatus {
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
