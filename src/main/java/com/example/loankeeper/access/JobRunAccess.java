package com.example.loankeeper.access;

import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.JobType;
import java.util.List;

/**
 * Storage abstraction for the append-only {@code job_runs} table. Rows are only ever inserted.
 */
public interface JobRunAccess {

    void put(JobRun run);

    /**
     * Most recent runs of one job type, newest first.
     */
    List<JobRun> findLatest(JobType jobType, int limit);

    /**
     * Most recent runs across all job types, newest first by finish time.
     *
     * @param limit maximum number of runs returned
     * @return at most {@code limit} runs
     */
    List<JobRun> findLatest(int limit);
}
