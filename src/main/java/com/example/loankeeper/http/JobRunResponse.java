package com.example.loankeeper.http;

import com.example.loankeeper.models.JobType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunResponse(
        @JsonProperty("id") String id,
        @JsonProperty("job_type") JobType jobType,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("started_at") Long startedAt,
        @JsonProperty("finished_at") Long finishedAt,
        @JsonProperty("success") Boolean success,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("summary") Map<String, Object> summary
) { }
