package com.example.loankeeper.scheduling;

import com.example.loankeeper.access.ScheduleAccess;
import com.example.loankeeper.config.SchedulerProperties;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.models.Schedule;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

/**
 * Trigger loop for stored schedules.
 *
 * <p>Each enabled schedule is kept as an armed trigger holding its next fire time. A fixed-delay
 * tick compares the clock against those times, hands due jobs to the {@link JobLauncher} and
 * re-arms them from the current time, so a tick that arrives late fires a schedule once rather
 * than replaying every missed slot. Schedule changes arm and disarm triggers directly; nothing
 * here waits on a running job.
 */
@Component
@Slf4j
public class LoanScheduler {

    private final ScheduleAccess scheduleAccess;
    private final JobLauncher jobLauncher;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final ConcurrentMap<String, ArmedTrigger> armed = new ConcurrentHashMap<>();
    private volatile boolean loaded;

    public LoanScheduler(ScheduleAccess scheduleAccess,
                         JobLauncher jobLauncher,
                         SchedulerProperties properties,
                         Clock clock) {
        this.scheduleAccess = scheduleAccess;
        this.jobLauncher = jobLauncher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${loan.scheduler.tick-interval-ms:30000}",
            initialDelayString = "${loan.scheduler.initial-delay-ms:5000}")
    public void scheduledTick() {
        if (!properties.isEnabled()) {
            return;
        }
        tick();
    }

    /**
     * One pass of the trigger loop.
     */
    public void tick() {
        if (!loaded && !reload()) {
            return;
        }
        Instant now = clock.instant();
        for (ArmedTrigger trigger : armed.values()) {
            if (trigger.nextFireAt().isAfter(now)) {
                continue;
            }
            jobLauncher.launch(trigger.jobType(), "cron:" + trigger.scheduleId());
            rearm(trigger, now);
        }
        jobLauncher.cancelOverdue();
    }

    /**
     * Rebuilds every trigger from the schedule table.
     *
     * @return false when the table could not be read; the next tick retries
     */
    public boolean reload() {
        List<Schedule> schedules;
        try {
            schedules = scheduleAccess.findAll();
        } catch (RuntimeException ex) {
            log.error("Could not load schedules, will retry on next tick: {}", ex.getMessage(), ex);
            return false;
        }
        armed.clear();
        schedules.forEach(this::apply);
        loaded = true;
        log.info("Loaded {} schedules, {} armed", schedules.size(), armed.size());
        return true;
    }

    /**
     * Brings the trigger for one schedule in line with its stored state: armed from now when
     * enabled, removed when disabled.
     */
    public void apply(Schedule schedule) {
        if (!Boolean.TRUE.equals(schedule.getEnabled())) {
            disarm(schedule.getScheduleId());
            return;
        }
        CronExpression cron;
        try {
            cron = CronSchedules.parse(schedule.getCronExpression());
        } catch (RuntimeException ex) {
            // stored rows are validated on write; this only catches rows edited out of band
            log.warn("Schedule {} has an unusable cron expression '{}': {}",
                    schedule.getScheduleId(), schedule.getCronExpression(), ex.getMessage());
            disarm(schedule.getScheduleId());
            return;
        }
        Optional<Instant> next = CronSchedules.nextFireTime(cron, clock.instant(), zone());
        if (next.isEmpty()) {
            log.warn("Schedule {} ('{}') never fires, not arming it",
                    schedule.getScheduleId(), schedule.getCronExpression());
            disarm(schedule.getScheduleId());
            return;
        }
        armed.put(schedule.getScheduleId(),
                new ArmedTrigger(schedule.getScheduleId(), schedule.getJobType(), cron, next.get()));
        log.info("Armed schedule {} ({} '{}'), next fire at {}",
                schedule.getScheduleId(), schedule.getJobType().wireName(),
                schedule.getCronExpression(), next.get());
    }

    public void disarm(String scheduleId) {
        if (armed.remove(scheduleId) != null) {
            log.info("Disarmed schedule {}", scheduleId);
        }
    }

    public Optional<Instant> nextFireTime(String scheduleId) {
        return Optional.ofNullable(armed.get(scheduleId)).map(ArmedTrigger::nextFireAt);
    }

    /**
     * Armed schedule ids with their next fire time, ordered by id.
     */
    public Map<String, Instant> armedTriggers() {
        Map<String, Instant> view = new TreeMap<>();
        armed.forEach((id, trigger) -> view.put(id, trigger.nextFireAt()));
        return view;
    }

    private void rearm(ArmedTrigger fired, Instant now) {
        Optional<Instant> next = CronSchedules.nextFireTime(fired.cron(), now, zone());
        // computeIfPresent: a schedule deleted while we were firing stays deleted
        armed.computeIfPresent(fired.scheduleId(), (id, current) -> {
            if (current != fired) {
                return current;
            }
            return next.map(fired::withNextFireAt).orElse(null);
        });
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getZone());
    }

    private record ArmedTrigger(String scheduleId, JobType jobType, CronExpression cron, Instant nextFireAt) {
        ArmedTrigger withNextFireAt(Instant next) {
            return new ArmedTrigger(scheduleId, jobType, cron, next);
        }
    }
}
