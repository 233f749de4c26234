package com.example.loankeeper.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ExtensionResponse(
        @JsonProperty("request_id") long requestId,
        @JsonProperty("extended") boolean extended,
        @JsonProperty("extended_at") long extendedAt,
        @JsonProperty("extended_by") String extendedBy,
        @JsonProperty("extension_days") int extensionDays,
        @JsonProperty("title") String title
) { }
