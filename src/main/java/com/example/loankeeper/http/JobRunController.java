package com.example.loankeeper.http;

import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.service.JobRunLogService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only job history, newest first.
 */
@RestController
public class JobRunController {

    private final JobRunLogService jobRunLogService;

    public JobRunController(JobRunLogService jobRunLogService) {
        this.jobRunLogService = jobRunLogService;
    }

    @GetMapping("/admin/jobs")
    public ResponseEntity<List<JobRunResponse>> latest(
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return ResponseEntity.ok(jobRunLogService.latest(limit).stream()
                .map(this::map)
                .toList());
    }

    private JobRunResponse map(JobRun run) {
        return new JobRunResponse(
                run.getRunId(),
                run.getJobType(),
                run.getTrigger(),
                run.getStartedAt(),
                run.getFinishedAt(),
                run.getSuccess(),
                run.getErrorMessage(),
                run.getSummary() != null ? run.getSummary() : Map.of()
        );
    }
}
