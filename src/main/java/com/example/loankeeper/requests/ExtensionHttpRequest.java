package com.example.loankeeper.requests;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Optional body for an extension request; identifies who asked for it.
 */
public record ExtensionHttpRequest(
        @JsonProperty("requested_by") String requestedBy
) {
}
