package com.example.loankeeper.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RetentionSettingsResponse(
        @JsonProperty("retention_days") int retentionDays,
        @JsonProperty("reminder_days") int reminderDays,
        @JsonProperty("extension_days") int extensionDays,
        @JsonProperty("extension_base_url") String extensionBaseUrl,
        @JsonProperty("zone") String zone
) { }
