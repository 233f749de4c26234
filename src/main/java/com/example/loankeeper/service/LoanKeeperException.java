package com.example.loankeeper.service;

import lombok.Getter;

public class LoanKeeperException extends RuntimeException {

    public enum Code {
        CONFIG_ERROR,
        NOT_FOUND,
        CONFLICT,
        COLLABORATOR_UNAVAILABLE,
        PARTIAL_ITEM_FAILURE,
        UNKNOWN
    }

    @Getter
    private final Code code;

    private LoanKeeperException(Code code, String message) {
        super(message);
        this.code = code;
    }

    private LoanKeeperException(Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static LoanKeeperException configError(String message) {
        return new LoanKeeperException(Code.CONFIG_ERROR, message);
    }

    public static LoanKeeperException invalidCron(String cronExpression, String reason) {
        return new LoanKeeperException(Code.CONFIG_ERROR,
                "Invalid cron expression '" + cronExpression + "': " + reason);
    }

    public static LoanKeeperException scheduleNotFound(String scheduleId) {
        return new LoanKeeperException(Code.NOT_FOUND,
                "Schedule " + scheduleId + " does not exist");
    }

    public static LoanKeeperException requestNotFound(long requestId) {
        return new LoanKeeperException(Code.NOT_FOUND,
                "Request " + requestId + " does not exist");
    }

    public static LoanKeeperException notYetAvailable(long requestId) {
        return new LoanKeeperException(Code.CONFIG_ERROR,
                "Request " + requestId + " is not yet available for extension");
    }

    public static LoanKeeperException alreadyExtended(long requestId) {
        return new LoanKeeperException(Code.CONFLICT,
                "Request " + requestId + " has already been extended");
    }

    public static LoanKeeperException collaboratorUnavailable(String collaborator, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
        return new LoanKeeperException(Code.COLLABORATOR_UNAVAILABLE,
                collaborator + " is unavailable" + detail, cause);
    }
}
