package com.facility.snapshot.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status token returned by the job control operations.
 */
public enum JobCommandResult {
    STARTED("started"),
    ALREADY_RUNNING("already_running"),
    PAUSED("paused"),
    RESUMED("resumed"),
    STOPPED("stopped"),
    NOT_RUNNING("not_running");

    private final String token;

    JobCommandResult(String token) {
        this.token = token;
    }

    @JsonValue
    public String getToken() {
        return token;
    }
}
