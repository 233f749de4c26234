package com.example.loankeeper.catalog;

/**
 * Sends reminder and deletion notices to the requesting user.
 */
public interface LoanNotifier {

    void sendReminder(ReminderNotice notice);

    void sendDeletionNotice(String email, String title);
}
