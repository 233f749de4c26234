package com.example.loankeeper.service;

import com.example.loankeeper.access.LoanRequestAccess;
import com.example.loankeeper.access.ReminderAccess;
import com.example.loankeeper.catalog.CatalogMedia;
import com.example.loankeeper.catalog.CatalogRequest;
import com.example.loankeeper.catalog.LoanNotifier;
import com.example.loankeeper.catalog.MediaCatalog;
import com.example.loankeeper.catalog.MediaDeleter;
import com.example.loankeeper.catalog.ReminderNotice;
import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.models.LoanRequest;
import com.example.loankeeper.models.PolicyConfig;
import com.example.loankeeper.models.Reminder;
import com.example.loankeeper.models.RetentionState;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Executes one check or process run and records it.
 *
 * <p>A run lists the catalog, brings the stored loans in line with it and evaluates every
 * started loan against a policy resolved once at the start. Check runs send reminders only;
 * process runs also hand expired loans to the {@link MediaDeleter} and drop loans the catalog
 * no longer lists. Problems with a single item are collected into the summary and the batch
 * continues. Exactly one {@link JobRun} is written per call, whatever happens.
 *
 * <p>Loans can be extended while a run is in progress, so writes go through
 * {@link LoanRequestAccess#mergeCatalogFields} and a deletion re-reads the loan first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobRunner {

    static final String MDC_JOB_RUN_ID = "jobRunId";

    static final String STAGE_CATALOG = "catalog";
    static final String STAGE_RECONCILE = "reconcile";
    static final String STAGE_REMIND = "remind";
    static final String STAGE_DELETE = "delete";
    static final String STAGE_NOTIFY = "notify";

    private final MediaCatalog mediaCatalog;
    private final MediaDeleter mediaDeleter;
    private final LoanNotifier loanNotifier;
    private final LoanRequestAccess loanRequestAccess;
    private final ReminderAccess reminderAccess;
    private final RetentionClock retentionClock;
    private final PolicySettingsService policySettingsService;
    private final JobRunLogService jobRunLogService;
    private final Clock clock;

    public JobRun run(JobType jobType, String trigger) {
        String correlationId = jobType.wireName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_JOB_RUN_ID, correlationId);
        long startedAt = clock.millis();
        RunSummary summary = new RunSummary(jobType);
        try {
            log.info("Starting {} run (trigger {})", jobType.wireName(), trigger);
            String error = execute(jobType, summary);
            // a cancelled worker is still interrupted here; the SDK refuses to write on such a thread
            boolean interrupted = Thread.interrupted();
            JobRun run;
            try {
                run = jobRunLogService.record(jobType, trigger, startedAt, error == null, error, summary.toMap());
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            if (error == null) {
                log.info("Finished {} run {}: {} reminders, {} deletions, {} failures",
                        jobType.wireName(), run.getRunId(), summary.remindersSentCount(),
                        summary.deletionCount(), summary.failureCount());
            } else {
                log.error("{} run {} failed: {}", jobType.wireName(), run.getRunId(), error);
            }
            return run;
        } finally {
            MDC.remove(MDC_JOB_RUN_ID);
        }
    }

    /**
     * @return null on success, otherwise the error message for the run
     */
    private String execute(JobType jobType, RunSummary summary) {
        PolicyConfig policy;
        List<CatalogRequest> requests;
        try {
            policy = policySettingsService.resolve();
        } catch (LoanKeeperException ex) {
            return ex.getMessage();
        }
        try {
            requests = mediaCatalog.listRequests();
        } catch (LoanKeeperException ex) {
            return ex.getMessage();
        } catch (RuntimeException ex) {
            log.warn("Listing catalog requests failed", ex);
            return LoanKeeperException.collaboratorUnavailable("Media catalog", ex).getMessage();
        }

        Map<Long, LoanRequest> loans = new HashMap<>();
        try {
            loanRequestAccess.findAll().forEach(loan -> loans.put(loan.getRequestId(), loan));
        } catch (RuntimeException ex) {
            log.error("Could not read stored loans", ex);
            return "Could not read stored loans: " + ex.getMessage();
        }

        Set<Long> listed = new HashSet<>();
        for (CatalogRequest request : requests) {
            if (Thread.currentThread().isInterrupted()) {
                return "Run cancelled after exceeding the run timeout";
            }
            listed.add(request.requestId());
            handle(jobType, request, loans.get(request.requestId()), policy, summary);
        }

        if (jobType == JobType.PROCESS) {
            dropUnlisted(loans, listed, summary);
        }
        return null;
    }

    private void handle(JobType jobType, CatalogRequest request, LoanRequest stored,
                        PolicyConfig policy, RunSummary summary) {
        Instant now = clock.instant();
        CatalogMedia media;
        try {
            media = mediaCatalog.describe(request);
        } catch (RuntimeException ex) {
            log.warn("Could not describe request {}: {}", request.requestId(), ex.getMessage());
            summary.failed(request.requestId(), stored == null ? null : stored.getTitle(),
                    request.requestedBy(), STAGE_CATALOG, ex);
            return;
        }

        LoanRequest loan;
        try {
            loan = reconcile(request, media, stored, now);
        } catch (RuntimeException ex) {
            log.warn("Could not save loan for request {}: {}", request.requestId(), ex.getMessage());
            summary.failed(request.requestId(), media.title(), request.requestedBy(), STAGE_RECONCILE, ex);
            return;
        }

        summary.checked();
        Optional<RetentionState> evaluated = retentionClock.evaluate(loan, now, policy);
        if (evaluated.isEmpty()) {
            return;
        }
        RetentionState state = evaluated.get();
        if (state.needsAttention()) {
            summary.needsAttention();
        }
        if (state.remind()) {
            remind(request, loan, state, policy, summary);
        }
        if (state.delete() && jobType == JobType.PROCESS) {
            deleteIfStillExpired(request, policy, summary);
        }
    }

    /**
     * Creates the loan on first sight, starts its countdown the first time the media is fully
     * available, and keeps the title current. Writes only when something changed.
     */
    private LoanRequest reconcile(CatalogRequest request, CatalogMedia media, LoanRequest stored, Instant now) {
        LoanRequest.LoanRequestBuilder builder = stored != null
                ? stored.toBuilder()
                : LoanRequest.builder()
                        .requestId(request.requestId())
                        .mediaType(request.mediaType())
                        .mediaId(request.mediaId())
                        .externalServiceId(request.externalServiceId())
                        .requestedBy(request.requestedBy())
                        .requestedAt(request.requestedAt().toEpochMilli())
                        .firstSeenAt(now.toEpochMilli());
        boolean changed = stored == null;

        if (media.title() != null && (stored == null || !media.title().equals(stored.getTitle()))) {
            builder.title(media.title());
            changed = true;
        }
        if (media.fullyAvailable() && (stored == null || stored.getAvailableSince() == null)) {
            Instant since = media.availableSince() == null || media.availableSince().isAfter(now)
                    ? now
                    : media.availableSince();
            builder.availableSince(since.toEpochMilli());
            changed = true;
            log.info("Request {} ('{}') is available, loan starts {}", request.requestId(), media.title(), since);
        }

        if (!changed) {
            return stored;
        }
        return loanRequestAccess.mergeCatalogFields(builder.build());
    }

    private void remind(CatalogRequest request, LoanRequest loan, RetentionState state,
                        PolicyConfig policy, RunSummary summary) {
        String email = loan.getRequestedBy();
        String windowKey = windowKey(state);
        try {
            if (reminderAccess.exists(loan.getRequestId(), windowKey)) {
                summary.alreadyReminded(loan.getTitle(), email, state.daysLeft());
                return;
            }
            loanNotifier.sendReminder(new ReminderNotice(loan.getRequestId(), email, loan.getTitle(),
                    state.daysLeft(), policy.extensionLink(loan.getRequestId())));
            reminderAccess.put(Reminder.builder()
                    .requestId(loan.getRequestId())
                    .windowKey(windowKey)
                    .sentAt(clock.millis())
                    .email(email)
                    .build());
            summary.reminderSent(loan.getTitle(), email, state.daysLeft());
            log.info("Reminded {} about request {} ('{}'), {} days left",
                    email, request.requestId(), loan.getTitle(), state.daysLeft());
        } catch (RuntimeException ex) {
            log.warn("Reminder for request {} failed: {}", request.requestId(), ex.getMessage());
            summary.failed(loan.getRequestId(), loan.getTitle(), email, STAGE_REMIND, ex);
        }
    }

    /**
     * Re-reads the loan and deletes only if it is still expired, so an extension granted while
     * this run was going is honoured.
     */
    private void deleteIfStillExpired(CatalogRequest request, PolicyConfig policy, RunSummary summary) {
        Optional<LoanRequest> current;
        try {
            current = loanRequestAccess.findByRequestId(request.requestId());
        } catch (RuntimeException ex) {
            log.warn("Could not re-read loan {} before deletion: {}", request.requestId(), ex.getMessage());
            summary.failed(request.requestId(), null, request.requestedBy(), STAGE_DELETE, ex);
            return;
        }
        if (current.isEmpty()) {
            log.info("Loan {} disappeared before deletion, skipping", request.requestId());
            return;
        }
        LoanRequest loan = current.get();
        boolean expired = retentionClock.evaluate(loan, clock.instant(), policy)
                .map(RetentionState::delete)
                .orElse(false);
        if (!expired) {
            log.info("Loan {} ('{}') was extended during the run, not deleting",
                    loan.getRequestId(), loan.getTitle());
            return;
        }
        delete(request, loan, summary);
    }

    private void delete(CatalogRequest request, LoanRequest loan, RunSummary summary) {
        String email = loan.getRequestedBy();
        try {
            mediaDeleter.delete(request);
        } catch (RuntimeException ex) {
            log.warn("Deleting request {} ('{}') failed, will retry next run: {}",
                    request.requestId(), loan.getTitle(), ex.getMessage());
            summary.failed(loan.getRequestId(), loan.getTitle(), email, STAGE_DELETE, ex);
            return;
        }
        summary.deleted(loan.getTitle(), email);
        log.info("Deleted request {} ('{}')", request.requestId(), loan.getTitle());

        try {
            loanNotifier.sendDeletionNotice(email, loan.getTitle());
        } catch (RuntimeException ex) {
            log.warn("Deletion notice for request {} failed: {}", request.requestId(), ex.getMessage());
            summary.failed(loan.getRequestId(), loan.getTitle(), email, STAGE_NOTIFY, ex);
        }
        removeLoan(loan, summary);
    }

    /**
     * Drops loans whose request the catalog no longer lists. An empty listing while loans are
     * stored is treated as a catalog fault and drops nothing.
     */
    private void dropUnlisted(Map<Long, LoanRequest> loans, Set<Long> listed, RunSummary summary) {
        if (listed.isEmpty() && !loans.isEmpty()) {
            log.warn("Catalog listed no requests while {} loans are stored, keeping them", loans.size());
            return;
        }
        loans.keySet().stream()
                .filter(requestId -> !listed.contains(requestId))
                .forEach(requestId -> forget(loans.get(requestId), summary));
    }

    private void forget(LoanRequest loan, RunSummary summary) {
        log.info("Request {} ('{}') is no longer in the catalog, dropping its loan",
                loan.getRequestId(), loan.getTitle());
        removeLoan(loan, summary);
    }

    private void removeLoan(LoanRequest loan, RunSummary summary) {
        try {
            loanRequestAccess.delete(loan.getRequestId());
            reminderAccess.deleteAllForRequest(loan.getRequestId());
        } catch (RuntimeException ex) {
            log.warn("Could not remove loan {}: {}", loan.getRequestId(), ex.getMessage());
            summary.failed(loan.getRequestId(), loan.getTitle(), loan.getRequestedBy(), STAGE_RECONCILE, ex);
        }
    }

    /**
     * Reminder windows are keyed by the effective retention, so granting an extension opens a
     * new window and allows one more reminder before the new deadline.
     */
    static String windowKey(RetentionState state) {
        return "retention-" + state.effectiveRetentionDays();
    }
}
