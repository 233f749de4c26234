package com.example.loankeeper.models;

import com.example.loankeeper.service.LoanKeeperException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Resolved retention policy for a single job run. Built once per run and handed to the
 * evaluation code, so a settings change mid-run cannot split one batch across two policies.
 */
public record PolicyConfig(
        int retentionDays,
        int reminderDays,
        int extensionDays,
        String extensionBaseUrl,
        ZoneId zone
) {
    public PolicyConfig {
        Objects.requireNonNull(zone, "zone");
        if (retentionDays < 1) {
            throw LoanKeeperException.configError("retention_days must be >= 1");
        }
        if (reminderDays < 1) {
            throw LoanKeeperException.configError("reminder_days must be >= 1");
        }
        if (reminderDays >= retentionDays) {
            throw LoanKeeperException.configError(
                    "reminder_days (" + reminderDays + ") must be less than retention_days (" + retentionDays + ")");
        }
        if (extensionDays < 1) {
            throw LoanKeeperException.configError("extension_days must be >= 1");
        }
    }

    public String extensionLink(long requestId) {
        String base = extensionBaseUrl == null ? "" : extensionBaseUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/extend?request_id=" + requestId;
    }
}
