package com.example.loankeeper.http;

import com.example.loankeeper.models.JobType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("job_type") JobType jobType,
        @JsonProperty("cron_expression") String cronExpression,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("created_at") Long createdAt,
        @JsonProperty("updated_at") Long updatedAt,
        @JsonProperty("next_fire_at") String nextFireAt
) { }
