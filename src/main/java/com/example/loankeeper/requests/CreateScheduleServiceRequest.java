package com.example.loankeeper.requests;

import com.example.loankeeper.models.JobType;
import java.util.Objects;

public record CreateScheduleServiceRequest(
        JobType jobType,
        String cronExpression,
        boolean enabled
) {
    public CreateScheduleServiceRequest {
        Objects.requireNonNull(jobType, "jobType");
        Objects.requireNonNull(cronExpression, "cronExpression");
    }
}
