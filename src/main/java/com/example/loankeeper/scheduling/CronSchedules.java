package com.example.loankeeper.scheduling;

import com.example.loankeeper.service.LoanKeeperException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.springframework.scheduling.support.CronExpression;

/**
 * Five-field crontab expressions (minute hour day month weekday) on top of Spring's
 * six-field {@link CronExpression}: the seconds field is pinned to 0.
 */
public final class CronSchedules {

    private static final int CRONTAB_FIELDS = 5;

    private CronSchedules() {
    }

    /**
     * Parses a crontab expression.
     *
     * @throws LoanKeeperException with code CONFIG_ERROR when the expression does not have exactly
     *                             five fields or one of the fields is out of range
     */
    public static CronExpression parse(String expression) {
        String normalized = normalize(expression);
        try {
            return CronExpression.parse("0 " + normalized);
        } catch (IllegalArgumentException ex) {
            throw LoanKeeperException.invalidCron(expression, ex.getMessage());
        }
    }

    /**
     * Collapses whitespace and checks the field count.
     */
    public static String normalize(String expression) {
        if (expression == null || expression.isBlank()) {
            throw LoanKeeperException.invalidCron(String.valueOf(expression), "expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != CRONTAB_FIELDS) {
            throw LoanKeeperException.invalidCron(expression,
                    "expected 5 fields (minute hour day month weekday) but got " + fields.length);
        }
        return String.join(" ", fields);
    }

    public static Optional<Instant> nextFireTime(CronExpression cron, Instant after, ZoneId zone) {
        ZonedDateTime next = cron.next(after.atZone(zone));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }
}
