package com.example.loankeeper.scheduling;

import com.example.loankeeper.models.JobType;

/**
 * Outcome of asking the launcher to start a job.
 *
 * @param jobType job that was asked for
 * @param status  what happened to the request
 * @param detail  human readable explanation
 */
public record LaunchResult(JobType jobType, Status status, String detail) {

    public enum Status {
        STARTED,
        SKIPPED,
        REJECTED
    }

    static LaunchResult started(JobType jobType) {
        return new LaunchResult(jobType, Status.STARTED, "Job started in background");
    }

    static LaunchResult skipped(JobType jobType, String runningTrigger) {
        return new LaunchResult(jobType, Status.SKIPPED,
                "A " + jobType.wireName() + " run (" + runningTrigger + ") is already in progress");
    }

    static LaunchResult rejected(JobType jobType) {
        return new LaunchResult(jobType, Status.REJECTED, "No worker available to start the job");
    }

    public boolean started() {
        return status == Status.STARTED;
    }
}
