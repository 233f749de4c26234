package com.example.loankeeper.models;

import java.util.Objects;

/**
 * The one extension a loan may receive. The granted days are captured with the grant so later
 * changes to the configured extension length do not move existing deadlines.
 */
public record ExtensionGrant(long grantedAt, String grantedBy, int days) {
    public ExtensionGrant {
        Objects.requireNonNull(grantedBy, "grantedBy");
        if (days < 1) {
            throw new IllegalArgumentException("extension days must be >= 1");
        }
    }
}
