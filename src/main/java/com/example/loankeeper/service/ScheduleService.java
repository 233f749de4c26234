package com.example.loankeeper.service;

import com.example.loankeeper.access.ScheduleAccess;
import com.example.loankeeper.models.Schedule;
import com.example.loankeeper.requests.CreateScheduleServiceRequest;
import com.example.loankeeper.requests.UpdateScheduleServiceRequest;
import com.example.loankeeper.scheduling.CronSchedules;
import com.example.loankeeper.scheduling.JobLauncher;
import com.example.loankeeper.scheduling.LaunchResult;
import com.example.loankeeper.scheduling.LoanScheduler;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * CRUD over stored schedules. Every successful write is pushed to the {@link LoanScheduler}
 * so the armed triggers always match the table.
 */
@Service
@Slf4j
public class ScheduleService {

    private final ScheduleAccess scheduleAccess;
    private final LoanScheduler scheduler;
    private final JobLauncher jobLauncher;
    private final Clock clock;

    public ScheduleService(ScheduleAccess scheduleAccess,
                           LoanScheduler scheduler,
                           JobLauncher jobLauncher,
                           Clock clock) {
        this.scheduleAccess = scheduleAccess;
        this.scheduler = scheduler;
        this.jobLauncher = jobLauncher;
        this.clock = clock;
    }

    public Schedule create(CreateScheduleServiceRequest request) {
        Objects.requireNonNull(request, "request");

        // validate before anything is written
        String cron = CronSchedules.normalize(request.cronExpression());
        CronSchedules.parse(cron);

        long now = clock.millis();
        Schedule schedule = Schedule.builder()
                .scheduleId(generateScheduleId(now))
                .jobType(request.jobType())
                .cronExpression(cron)
                .enabled(request.enabled())
                .createdAt(now)
                .updatedAt(now)
                .build();
        scheduleAccess.save(schedule);
        scheduler.apply(schedule);

        log.info("Created schedule {} ({} '{}', enabled={})",
                schedule.getScheduleId(), schedule.getJobType().wireName(), cron, schedule.getEnabled());
        return schedule;
    }

    public Schedule get(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        return scheduleAccess.findById(scheduleId)
                .orElseThrow(() -> LoanKeeperException.scheduleNotFound(scheduleId));
    }

    public List<Schedule> list() {
        return scheduleAccess.findAll();
    }

    public Schedule update(String scheduleId, UpdateScheduleServiceRequest patch) {
        Objects.requireNonNull(patch, "patch");
        Schedule existing = get(scheduleId);

        Schedule.ScheduleBuilder builder = existing.toBuilder().updatedAt(clock.millis());
        if (patch.jobType() != null) {
            builder.jobType(patch.jobType());
        }
        if (patch.cronExpression() != null) {
            String cron = CronSchedules.normalize(patch.cronExpression());
            CronSchedules.parse(cron);
            builder.cronExpression(cron);
        }
        if (patch.enabled() != null) {
            builder.enabled(patch.enabled());
        }

        Schedule updated = scheduleAccess.update(builder.build())
                .orElseThrow(() -> LoanKeeperException.scheduleNotFound(scheduleId));
        scheduler.apply(updated);

        log.info("Updated schedule {} ({} '{}', enabled={})",
                scheduleId, updated.getJobType().wireName(), updated.getCronExpression(), updated.getEnabled());
        return updated;
    }

    public void delete(String scheduleId) {
        Objects.requireNonNull(scheduleId, "scheduleId");
        if (!scheduleAccess.delete(scheduleId)) {
            throw LoanKeeperException.scheduleNotFound(scheduleId);
        }
        scheduler.disarm(scheduleId);
        log.info("Deleted schedule {}", scheduleId);
    }

    /**
     * Starts the schedule's job immediately, whether or not the schedule is enabled. Returns as
     * soon as the run is handed to a worker (or skipped because one is already in flight).
     */
    public LaunchResult runNow(String scheduleId) {
        Schedule schedule = get(scheduleId);
        return jobLauncher.launch(schedule.getJobType(), "run-now:" + scheduleId);
    }

    /**
     * Time-ordered id: "{millis}_{random}" sorts by creation time.
     */
    private String generateScheduleId(long timestamp) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase();
        return String.format("%013d_%s", timestamp, random);
    }
}
