package com.example.loankeeper.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateScheduleHttpRequest(
        @JsonProperty("job_type") String jobType,
        @JsonProperty("cron_expression") String cronExpression,
        @JsonProperty("enabled") Boolean enabled
) {
}
