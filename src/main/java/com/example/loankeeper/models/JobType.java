package com.example.loankeeper.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kinds of job the scheduler can run. {@link #CHECK} evaluates loans and sends reminders,
 * {@link #PROCESS} additionally deletes media whose loan has run out.
 */
public enum JobType {
    CHECK,
    PROCESS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static JobType fromString(String v) {
        if (v != null) {
            for (JobType t : values()) {
                if (t.wireName().equalsIgnoreCase(v.trim())) {
                    return t;
                }
            }
        }
        throw new IllegalArgumentException("Unknown job type: " + v);
    }
}
