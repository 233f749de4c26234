package com.example.loankeeper.catalog;

public record ReminderNotice(
        long requestId,
        String email,
        String title,
        long daysLeft,
        String extensionLink
) {
}
