package com.example.loankeeper.access;

import com.example.loankeeper.models.Reminder;

public interface ReminderAccess {

    boolean exists(long requestId, String windowKey);

    void put(Reminder reminder);

    /**
     * Forgets every reminder sent for a loan, used once its media has been deleted.
     */
    void deleteAllForRequest(long requestId);
}
