package com.facility.snapshot.dto;

import com.facility.snapshot.job.JobCommandResult;
import com.fasterxml.jackson.annotation.JsonProperty;

public record JobCommandResponse(
    @JsonProperty("status")
    JobCommandResult status
) {
}
