package com.example.loankeeper.catalog;

import lombok.extern.slf4j.Slf4j;

/**
 * Notifier used when no mail transport is configured. Notices are written to the log only.
 */
@Slf4j
public class LoggingLoanNotifier implements LoanNotifier {

    @Override
    public void sendReminder(ReminderNotice notice) {
        log.info("Reminder for request {} to {}: '{}' will be removed in {} days, extend at {}",
                notice.requestId(), notice.email(), notice.title(), notice.daysLeft(), notice.extensionLink());
    }

    @Override
    public void sendDeletionNotice(String email, String title) {
        log.info("Deletion notice to {}: '{}' has been removed", email, title);
    }
}
