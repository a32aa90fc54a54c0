package com.facility.snapshot.job;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time view of the snapshot job.
 *
 * @param jobPaused null when the job is not registered
 */
public record JobStatus(
    @JsonProperty("scheduler_running")
    boolean schedulerRunning,

    @JsonProperty("job_exists")
    boolean jobExists,

    @JsonProperty("job_paused")
    Boolean jobPaused
) {
}
