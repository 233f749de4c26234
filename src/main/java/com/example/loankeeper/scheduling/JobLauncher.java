package com.example.loankeeper.scheduling;

import com.example.loankeeper.config.SchedulerProperties;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.service.JobRunner;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Starts job runs on the worker pool while keeping at most one run per job type in flight.
 * Cron fires and run-now requests both go through here; a request for a job type that is
 * already running is skipped, not queued.
 */
@Component
@Slf4j
public class JobLauncher {

    private final JobRunner jobRunner;
    private final AsyncTaskExecutor executor;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final ConcurrentMap<JobType, InFlight> inFlight = new ConcurrentHashMap<>();

    public JobLauncher(JobRunner jobRunner,
                       @Qualifier("jobExecutor") AsyncTaskExecutor executor,
                       SchedulerProperties properties,
                       Clock clock) {
        this.jobRunner = jobRunner;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    public LaunchResult launch(JobType jobType, String trigger) {
        InFlight slot = new InFlight(trigger, clock.instant());
        InFlight running = inFlight.putIfAbsent(jobType, slot);
        if (running != null) {
            log.info("Skipping {} run triggered by {}: run triggered by {} in flight since {}",
                    jobType.wireName(), trigger, running.trigger, running.startedAt);
            return LaunchResult.skipped(jobType, running.trigger);
        }

        try {
            slot.future = executor.submit(() -> execute(jobType, slot));
        } catch (RejectedExecutionException ex) {
            inFlight.remove(jobType, slot);
            log.error("Could not start {} run triggered by {}: {}", jobType.wireName(), trigger, ex.getMessage());
            return LaunchResult.rejected(jobType);
        }
        log.info("Started {} run triggered by {}", jobType.wireName(), trigger);
        return LaunchResult.started(jobType);
    }

    /**
     * Interrupts runs that have exceeded loan.scheduler.run-timeout. The slot is released when
     * the worker actually returns.
     */
    public void cancelOverdue() {
        Instant now = clock.instant();
        inFlight.forEach((jobType, slot) -> {
            if (!slot.cancelRequested && slot.startedAt.plus(properties.getRunTimeout()).isBefore(now)) {
                slot.cancelRequested = true;
                log.warn("{} run triggered by {} exceeded {} (started {}), abandoning it",
                        jobType.wireName(), slot.trigger, properties.getRunTimeout(), slot.startedAt);
                Future<?> future = slot.future;
                if (future != null) {
                    future.cancel(true);
                }
            }
        });
    }

    public boolean isRunning(JobType jobType) {
        return inFlight.containsKey(jobType);
    }

    public Set<JobType> running() {
        Set<JobType> running = EnumSet.noneOf(JobType.class);
        running.addAll(inFlight.keySet());
        return running;
    }

    private void execute(JobType jobType, InFlight slot) {
        try {
            jobRunner.run(jobType, slot.trigger);
        } catch (RuntimeException ex) {
            // the runner records its own failures; this is a failure to record one
            log.error("{} run triggered by {} could not be completed: {}",
                    jobType.wireName(), slot.trigger, ex.getMessage(), ex);
        } finally {
            inFlight.remove(jobType, slot);
        }
    }

    private static final class InFlight {
        private final String trigger;
        private final Instant startedAt;
        private volatile Future<?> future;
        private volatile boolean cancelRequested;

        private InFlight(String trigger, Instant startedAt) {
            this.trigger = trigger;
            this.startedAt = startedAt;
        }
    }
}
