package com.example.loankeeper.service;

import com.example.loankeeper.access.JobRunAccess;
import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.JobType;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Append-only history of job runs. Each run is written as a single item, so its outcome and
 * summary are stored together or not at all.
 */
@Service
@RequiredArgsConstructor
public class JobRunLogService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    private final JobRunAccess jobRunAccess;
    private final Clock clock;

    /**
     * Records a finished run. Serialized so that finish timestamps, and therefore the stored
     * order, follow the order in which runs complete.
     */
    public synchronized JobRun record(JobType jobType,
                                      String trigger,
                                      long startedAt,
                                      boolean success,
                                      String errorMessage,
                                      Map<String, Object> summary) {
        long finishedAt = clock.millis();
        JobRun run = JobRun.builder()
                .jobType(jobType)
                .runId(generateRunId(finishedAt))
                .trigger(trigger)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .success(success)
                .errorMessage(errorMessage)
                .summary(summary)
                .build();
        jobRunAccess.put(run);
        return run;
    }

    /**
     * Latest runs, newest first.
     */
    public List<JobRun> latest(int limit) {
        int effective = Math.max(1, Math.min(limit, MAX_LIMIT));
        return jobRunAccess.findLatest(effective);
    }

    public List<JobRun> latest(JobType jobType, int limit) {
        int effective = Math.max(1, Math.min(limit, MAX_LIMIT));
        return jobRunAccess.findLatest(jobType, effective);
    }

    private String generateRunId(long timestamp) {
        String random = UUID.randomUUID().toString().replace("-", "").toUpperCase();
        return String.format("%013d_%s", timestamp, random);
    }
}
