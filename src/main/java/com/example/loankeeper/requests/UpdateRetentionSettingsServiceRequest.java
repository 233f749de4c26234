package com.example.loankeeper.requests;

/**
 * Partial policy update. Null fields keep their current value.
 */
public record UpdateRetentionSettingsServiceRequest(
        Integer retentionDays,
        Integer reminderDays,
        Integer extensionDays,
        String extensionBaseUrl
) {
    public UpdateRetentionSettingsServiceRequest {
        if (retentionDays == null && reminderDays == null && extensionDays == null && extensionBaseUrl == null) {
            throw new IllegalArgumentException("at least one setting must be provided");
        }
    }
}
