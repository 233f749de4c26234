package com.example.loankeeper.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.loankeeper.config.SchedulerProperties;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.models.Schedule;
import com.example.loankeeper.requests.CreateScheduleServiceRequest;
import com.example.loankeeper.requests.UpdateScheduleServiceRequest;
import com.example.loankeeper.scheduling.JobLauncher;
import com.example.loankeeper.scheduling.LaunchResult;
import com.example.loankeeper.scheduling.LoanScheduler;
import com.example.loankeeper.testutil.InMemoryScheduleAccess;
import com.example.loankeeper.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2024-04-01T09:00:00Z");

    @Mock
    private JobLauncher jobLauncher;

    private MutableClock clock;
    private InMemoryScheduleAccess schedules;
    private LoanScheduler scheduler;
    private ScheduleService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        schedules = new InMemoryScheduleAccess();
        scheduler = new LoanScheduler(schedules, jobLauncher, new SchedulerProperties(), clock);
        service = new ScheduleService(schedules, scheduler, jobLauncher, clock);
    }

    @Test
    @DisplayName("four-field cron is rejected and nothing is stored")
    void rejectsFourFieldCron() {
        LoanKeeperException ex = assertThrows(LoanKeeperException.class,
                () -> service.create(new CreateScheduleServiceRequest(JobType.CHECK, "0 3 * *", true)));

        assertEquals(LoanKeeperException.Code.CONFIG_ERROR, ex.getCode());
        assertEquals(0, schedules.size());
        assertTrue(scheduler.armedTriggers().isEmpty());
    }

    @Test
    @DisplayName("created schedule reads back unchanged and is armed")
    void roundTrip() {
        Schedule created = service.create(new CreateScheduleServiceRequest(JobType.PROCESS, " 0  3 * * * ", true));

        Schedule read = service.get(created.getScheduleId());
        assertEquals(JobType.PROCESS, read.getJobType());
        assertEquals("0 3 * * *", read.getCronExpression());
        assertTrue(read.getEnabled());
        assertEquals(NOW.toEpochMilli(), read.getCreatedAt());
        assertEquals(List.of(created.getScheduleId()),
                service.list().stream().map(Schedule::getScheduleId).toList());
        assertEquals(Instant.parse("2024-04-02T03:00:00Z"),
                scheduler.nextFireTime(created.getScheduleId()).orElseThrow());
    }

    @Test
    @DisplayName("list is ordered by id, which is creation order")
    void listOrderedByCreation() {
        Schedule first = service.create(new CreateScheduleServiceRequest(JobType.CHECK, "0 * * * *", true));
        clock.advance(Duration.ofSeconds(1));
        Schedule second = service.create(new CreateScheduleServiceRequest(JobType.PROCESS, "0 * * * *", false));

        assertEquals(List.of(first.getScheduleId(), second.getScheduleId()),
                service.list().stream().map(Schedule::getScheduleId).toList());
    }

    @Test
    @DisplayName("deleted schedule is gone and never fires")
    void deleteStopsFiring() {
        Schedule created = service.create(new CreateScheduleServiceRequest(JobType.CHECK, "* * * * *", true));

        service.delete(created.getScheduleId());
        clock.advance(Duration.ofMinutes(5));
        scheduler.tick();

        LoanKeeperException ex = assertThrows(LoanKeeperException.class, () -> service.get(created.getScheduleId()));
        assertEquals(LoanKeeperException.Code.NOT_FOUND, ex.getCode());
        verify(jobLauncher, never()).launch(any(), anyString());
    }

    @Test
    @DisplayName("patch updates only the given fields and re-arms the trigger")
    void patch() {
        Schedule created = service.create(new CreateScheduleServiceRequest(JobType.CHECK, "0 3 * * *", true));
        clock.advance(Duration.ofMinutes(1));

        Schedule updated = service.update(created.getScheduleId(),
                new UpdateScheduleServiceRequest(null, "30 9 * * *", null));

        assertEquals(JobType.CHECK, updated.getJobType());
        assertEquals("30 9 * * *", updated.getCronExpression());
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertEquals(NOW.plus(Duration.ofMinutes(1)).toEpochMilli(), updated.getUpdatedAt());
        assertEquals(Instant.parse("2024-04-01T09:30:00Z"),
                scheduler.nextFireTime(created.getScheduleId()).orElseThrow());
    }

    @Test
    @DisplayName("disabling a schedule disarms it but keeps it stored")
    void disable() {
        Schedule created = service.create(new CreateScheduleServiceRequest(JobType.CHECK, "* * * * *", true));

        service.update(created.getScheduleId(), new UpdateScheduleServiceRequest(null, null, false));

        assertFalse(scheduler.nextFireTime(created.getScheduleId()).isPresent());
        assertFalse(service.get(created.getScheduleId()).getEnabled());
    }

    @Test
    @DisplayName("invalid cron in a patch leaves the stored schedule untouched")
    void invalidPatch() {
        Schedule created = service.create(new CreateScheduleServiceRequest(JobType.CHECK, "0 3 * * *", true));

        assertThrows(LoanKeeperException.class, () -> service.update(created.getScheduleId(),
                new UpdateScheduleServiceRequest(null, "0 99 * * *", null)));

        assertEquals("0 3 * * *", service.get(created.getScheduleId()).getCronExpression());
    }

    @Test
    @DisplayName("operations on unknown ids are not found")
    void unknownIds() {
        UpdateScheduleServiceRequest patch = new UpdateScheduleServiceRequest(null, null, true);

        assertEquals(LoanKeeperException.Code.NOT_FOUND,
                assertThrows(LoanKeeperException.class, () -> service.get("nope")).getCode());
        assertEquals(LoanKeeperException.Code.NOT_FOUND,
                assertThrows(LoanKeeperException.class, () -> service.update("nope", patch)).getCode());
        assertEquals(LoanKeeperException.Code.NOT_FOUND,
                assertThrows(LoanKeeperException.class, () -> service.delete("nope")).getCode());
        assertEquals(LoanKeeperException.Code.NOT_FOUND,
                assertThrows(LoanKeeperException.class, () -> service.runNow("nope")).getCode());
    }

    @Test
    @DisplayName("run-now launches the schedule's job even when it is disabled")
    void runNowDisabled() {
        Schedule created = service.create(new CreateScheduleServiceRequest(JobType.PROCESS, "0 3 * * *", false));
        LaunchResult started = new LaunchResult(JobType.PROCESS, LaunchResult.Status.STARTED, "started");
        when(jobLauncher.launch(JobType.PROCESS, "run-now:" + created.getScheduleId())).thenReturn(started);

        LaunchResult result = service.runNow(created.getScheduleId());

        assertEquals(started, result);
    }
}
