package com.example.loankeeper.models;

/**
 * Where a started loan stands on a given day. Derived on every evaluation, never stored.
 *
 * @param daysElapsed            whole calendar days since the media became available
 * @param effectiveRetentionDays base retention plus any granted extension
 * @param daysLeft               {@code effectiveRetentionDays - daysElapsed}, may be negative
 * @param remind                 {@code 0 < daysLeft <= reminderDays}
 * @param delete                 {@code daysLeft <= 0}
 * @param extended               whether the loan has used its extension
 */
public record RetentionState(
        long daysElapsed,
        long effectiveRetentionDays,
        long daysLeft,
        boolean remind,
        boolean delete,
        boolean extended
) {
    public boolean needsAttention() {
        return remind || delete;
    }
}
