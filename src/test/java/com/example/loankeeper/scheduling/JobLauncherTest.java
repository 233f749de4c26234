package com.example.loankeeper.scheduling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.loankeeper.config.SchedulerProperties;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.service.JobRunner;
import com.example.loankeeper.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class JobLauncherTest {

    private static final Instant NOW = Instant.parse("2024-04-01T09:00:00Z");

    private MutableClock clock;
    private JobRunner jobRunner;
    private ThreadPoolTaskExecutor executor;
    private SchedulerProperties properties;
    private JobLauncher launcher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        jobRunner = mock(JobRunner.class);
        properties = new SchedulerProperties();
        properties.setRunTimeout(Duration.ofMinutes(10));

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("test-job-");
        executor.initialize();

        launcher = new JobLauncher(jobRunner, executor, properties, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("a second trigger for a running job type is skipped and only one run happens")
    void singleFlight() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(jobRunner.run(eq(JobType.CHECK), anyString())).thenAnswer(inv -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });

        LaunchResult first = launcher.launch(JobType.CHECK, "cron:s1");
        assertTrue(started.await(5, TimeUnit.SECONDS));
        LaunchResult second = launcher.launch(JobType.CHECK, "run-now:s1");

        assertEquals(LaunchResult.Status.STARTED, first.status());
        assertEquals(LaunchResult.Status.SKIPPED, second.status());
        assertTrue(second.detail().contains("cron:s1"));
        assertTrue(launcher.isRunning(JobType.CHECK));

        release.countDown();
        awaitIdle(JobType.CHECK);

        verify(jobRunner, times(1)).run(any(), anyString());
        verify(jobRunner).run(JobType.CHECK, "cron:s1");
    }

    @Test
    @DisplayName("different job types run side by side")
    void differentTypesOverlap() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        when(jobRunner.run(any(), anyString())).thenAnswer(inv -> {
            bothStarted.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        });

        assertTrue(launcher.launch(JobType.CHECK, "cron:a").started());
        assertTrue(launcher.launch(JobType.PROCESS, "cron:b").started());
        assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
        assertEquals(Set.of(JobType.CHECK, JobType.PROCESS), launcher.running());

        release.countDown();
        awaitIdle(JobType.CHECK);
        awaitIdle(JobType.PROCESS);
    }

    @Test
    @DisplayName("a run that throws frees its slot for the next trigger")
    void failureFreesSlot() throws Exception {
        when(jobRunner.run(eq(JobType.PROCESS), anyString()))
                .thenThrow(new IllegalStateException("job_runs table unavailable"))
                .thenReturn(null);

        assertTrue(launcher.launch(JobType.PROCESS, "cron:s1").started());
        awaitIdle(JobType.PROCESS);

        assertTrue(launcher.launch(JobType.PROCESS, "cron:s1").started());
        awaitIdle(JobType.PROCESS);
        verify(jobRunner, times(2)).run(JobType.PROCESS, "cron:s1");
    }

    @Test
    @DisplayName("runs past the timeout are interrupted and release their slot")
    void overdueRunCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(jobRunner.run(eq(JobType.PROCESS), anyString())).thenAnswer(inv -> {
            started.countDown();
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
            }
            return null;
        });

        launcher.launch(JobType.PROCESS, "cron:s1");
        assertTrue(started.await(5, TimeUnit.SECONDS));

        launcher.cancelOverdue();
        assertTrue(launcher.isRunning(JobType.PROCESS));

        clock.advance(Duration.ofMinutes(11));
        launcher.cancelOverdue();

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        awaitIdle(JobType.PROCESS);
        assertFalse(launcher.isRunning(JobType.PROCESS));
    }

    private void awaitIdle(JobType jobType) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (launcher.isRunning(jobType) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertFalse(launcher.isRunning(jobType), jobType + " still running");
    }
}
