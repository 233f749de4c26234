package com.example.loankeeper.http;

import com.example.loankeeper.models.JobType;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgment for a run-now request. {@code status} is "started" or "skipped"; the run
 * itself is reported through the job history.
 */
public record RunNowResponse(
        @JsonProperty("schedule_id") String scheduleId,
        @JsonProperty("job_type") JobType jobType,
        @JsonProperty("status") String status,
        @JsonProperty("message") String message
) { }
