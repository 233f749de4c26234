package com.example.loankeeper.service;

import com.example.loankeeper.models.ExtensionGrant;
import com.example.loankeeper.models.LoanRequest;
import com.example.loankeeper.models.PolicyConfig;
import com.example.loankeeper.models.RetentionState;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Pure loan arithmetic. Day counts are whole calendar days between the dates of the two
 * instants in the policy zone, so a loan ages by one day at local midnight rather than 24 hours
 * after it became available.
 */
@Component
public class RetentionClock {

    /**
     * Evaluates a loan at {@code now}.
     *
     * @return empty when the loan has not started (media not fully available yet)
     */
    public Optional<RetentionState> evaluate(LoanRequest loan, Instant now, PolicyConfig policy) {
        Objects.requireNonNull(loan, "loan");
        if (loan.getAvailableSince() == null) {
            return Optional.empty();
        }
        int extraDays = loan.extension().map(ExtensionGrant::days).orElse(0);
        return Optional.of(evaluate(Instant.ofEpochMilli(loan.getAvailableSince()), extraDays, now, policy));
    }

    public RetentionState evaluate(Instant availableSince, int extensionDays, Instant now, PolicyConfig policy) {
        Objects.requireNonNull(availableSince, "availableSince");
        Objects.requireNonNull(now, "now");
        Objects.requireNonNull(policy, "policy");

        LocalDate start = LocalDate.ofInstant(availableSince, policy.zone());
        LocalDate today = LocalDate.ofInstant(now, policy.zone());
        long elapsed = ChronoUnit.DAYS.between(start, today);

        long effective = (long) policy.retentionDays() + Math.max(0, extensionDays);
        long daysLeft = effective - elapsed;
        boolean delete = daysLeft <= 0;
        boolean remind = daysLeft > 0 && daysLeft <= policy.reminderDays();

        return new RetentionState(elapsed, effective, daysLeft, remind, delete, extensionDays > 0);
    }
}
