package com.example.loankeeper.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * HTTP payload for schedule creation. {@code enabled} defaults to true when omitted.
 */
public record CreateScheduleHttpRequest(
        @JsonProperty("job_type") @NotBlank String jobType,
        @JsonProperty("cron_expression") @NotBlank String cronExpression,
        @JsonProperty("enabled") Boolean enabled
) {
}
