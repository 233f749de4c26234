package com.example.loankeeper.cli;

import com.example.loankeeper.catalog.MediaCatalog;
import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.models.PolicyConfig;
import com.example.loankeeper.service.JobRunner;
import com.example.loankeeper.service.LoanKeeperException;
import com.example.loankeeper.service.PolicySettingsService;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * One-shot commands for cron-driven or manual use outside the HTTP service.
 *
 * <ul>
 *   <li>{@code validate}: resolves the policy and probes the catalog</li>
 *   <li>{@code check}: runs a check job</li>
 *   <li>{@code process}: runs a process job</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoanCommands {

    public static final List<String> COMMANDS = List.of("validate", "check", "process");

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;

    static final String CLI_TRIGGER = "cli";

    private final PolicySettingsService policySettingsService;
    private final MediaCatalog mediaCatalog;
    private final JobRunner jobRunner;

    public int execute(String command) {
        String normalized = command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "validate":
                return validate();
            case "check":
                return runJob(JobType.CHECK);
            case "process":
                return runJob(JobType.PROCESS);
            default:
                log.error("Unknown command '{}', expected one of {}", command, COMMANDS);
                return USAGE;
        }
    }

    private int validate() {
        PolicyConfig policy;
        try {
            policy = policySettingsService.resolve();
        } catch (LoanKeeperException ex) {
            log.error("Retention policy is invalid: {}", ex.getMessage());
            return FAILED;
        }
        log.info("Retention policy: retention_days={} reminder_days={} extension_days={} extension_base_url={} zone={}",
                policy.retentionDays(), policy.reminderDays(), policy.extensionDays(),
                policy.extensionBaseUrl(), policy.zone());

        boolean reachable;
        try {
            reachable = mediaCatalog.isReachable();
        } catch (RuntimeException ex) {
            log.error("Media catalog probe failed: {}", ex.getMessage());
            return FAILED;
        }
        if (!reachable) {
            log.error("Media catalog is not reachable");
            return FAILED;
        }
        log.info("Media catalog is reachable, configuration is valid");
        return OK;
    }

    private int runJob(JobType jobType) {
        JobRun run = jobRunner.run(jobType, CLI_TRIGGER);
        if (Boolean.TRUE.equals(run.getSuccess())) {
            log.info("{} run {} succeeded: {}", jobType.wireName(), run.getRunId(), run.getSummary());
            return OK;
        }
        log.error("{} run {} failed: {}", jobType.wireName(), run.getRunId(), run.getErrorMessage());
        return FAILED;
    }
}
