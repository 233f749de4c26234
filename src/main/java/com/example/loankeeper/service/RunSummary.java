package com.example.loankeeper.service;

import com.example.loankeeper.models.JobType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates what one job run did. {@link #toMap()} produces the structure stored on the
 * {@code JobRun} row: counts for check runs, item lists for process runs, failures for both.
 */
class RunSummary {

    static final String ITEMS_CHECKED = "items_checked";
    static final String NEEDING_ATTENTION = "needing_attention";
    static final String REMINDERS_SENT = "reminders_sent";
    static final String NEEDS_ATTENTION = "needs_attention";
    static final String DELETIONS = "deletions";
    static final String FAILURES = "failures";

    private final JobType jobType;
    private int itemsChecked;
    private int needingAttention;
    private final List<Map<String, Object>> remindersSent = new ArrayList<>();
    private final List<Map<String, Object>> alreadyReminded = new ArrayList<>();
    private final List<Map<String, Object>> deletions = new ArrayList<>();
    private final List<Map<String, Object>> failures = new ArrayList<>();

    RunSummary(JobType jobType) {
        this.jobType = jobType;
    }

    void checked() {
        itemsChecked++;
    }

    void needsAttention() {
        needingAttention++;
    }

    void reminderSent(String title, String email, long daysLeft) {
        remindersSent.add(reminderEntry(title, email, daysLeft));
    }

    void alreadyReminded(String title, String email, long daysLeft) {
        alreadyReminded.add(reminderEntry(title, email, daysLeft));
    }

    void deleted(String title, String email) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("title", title);
        entry.put("email", email);
        deletions.add(entry);
    }

    void failed(long requestId, String title, String email, String stage, Throwable error) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("request_id", requestId);
        entry.put("title", title);
        entry.put("email", email);
        entry.put("stage", stage);
        entry.put("code", LoanKeeperException.Code.PARTIAL_ITEM_FAILURE.name());
        entry.put("error", error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        failures.add(entry);
    }

    int remindersSentCount() {
        return remindersSent.size();
    }

    int deletionCount() {
        return deletions.size();
    }

    int failureCount() {
        return failures.size();
    }

    Map<String, Object> toMap() {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (jobType == JobType.CHECK) {
            summary.put(ITEMS_CHECKED, itemsChecked);
            summary.put(NEEDING_ATTENTION, needingAttention);
        } else {
            summary.put(REMINDERS_SENT, List.copyOf(remindersSent));
            summary.put(NEEDS_ATTENTION, List.copyOf(alreadyReminded));
            summary.put(DELETIONS, List.copyOf(deletions));
        }
        summary.put(FAILURES, List.copyOf(failures));
        return summary;
    }

    private static Map<String, Object> reminderEntry(String title, String email, long daysLeft) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("title", title);
        entry.put("email", email);
        entry.put("days_left", daysLeft);
        return entry;
    }
}
