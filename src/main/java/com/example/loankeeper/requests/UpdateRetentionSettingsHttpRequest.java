package com.example.loankeeper.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateRetentionSettingsHttpRequest(
        @JsonProperty("retention_days") @Min(1) @Max(3650) Integer retentionDays,
        @JsonProperty("reminder_days") @Min(1) @Max(3650) Integer reminderDays,
        @JsonProperty("extension_days") @Min(1) @Max(365) Integer extensionDays,
        @JsonProperty("extension_base_url") String extensionBaseUrl
) {
}
