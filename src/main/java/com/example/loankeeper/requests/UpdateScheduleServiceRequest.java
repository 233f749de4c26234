package com.example.loankeeper.requests;

import com.example.loankeeper.models.JobType;

/**
 * Patch for an existing schedule. Null fields are left unchanged.
 */
public record UpdateScheduleServiceRequest(
        JobType jobType,
        String cronExpression,
        Boolean enabled
) {
}
