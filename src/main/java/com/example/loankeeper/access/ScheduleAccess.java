package com.example.loankeeper.access;

import com.example.loankeeper.models.Schedule;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the {@code schedules} table.
 */
public interface ScheduleAccess {

    Optional<Schedule> findById(String scheduleId);

    /**
     * All schedules ordered by id, which is creation order.
     */
    List<Schedule> findAll();

    /**
     * Creates a new schedule. Fails if the id is already taken.
     */
    Schedule save(Schedule schedule);

    /**
     * Replaces an existing schedule.
     *
     * @return the stored schedule, or empty when no schedule with that id exists
     */
    Optional<Schedule> update(Schedule schedule);

    /**
     * @return true when a schedule was removed
     */
    boolean delete(String scheduleId);
}
