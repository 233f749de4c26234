package com.example.loankeeper.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.loankeeper.access.DynamoJobRunAccess;
import com.example.loankeeper.access.DynamoLoanRequestAccess;
import com.example.loankeeper.access.DynamoReminderAccess;
import com.example.loankeeper.access.DynamoSettingAccess;
import com.example.loankeeper.access.LoanRequestAccess;
import com.example.loankeeper.access.ReminderAccess;
import com.example.loankeeper.catalog.ReminderNotice;
import com.example.loankeeper.config.LoanPolicyProperties;
import com.example.loankeeper.models.JobRun;
import com.example.loankeeper.models.JobType;
import com.example.loankeeper.testutil.LocalStackDynamo;
import com.example.loankeeper.testutil.MutableClock;
import com.example.loankeeper.testutil.RecordingLoanNotifier;
import com.example.loankeeper.testutil.RecordingMediaDeleter;
import com.example.loankeeper.testutil.StubMediaCatalog;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;

/**
 * A loan from first sighting to deletion with every table on LocalStack: reminder, extension,
 * second reminder in the extended window, then deletion once the extended loan runs out.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class LoanLifecycleDynamoIntegrationTest {

    private static final Instant NOW = Instant.parse("2024-04-01T09:00:00Z");

    @Container
    private static final LocalStackContainer LOCALSTACK = LocalStackDynamo.container();

    private DynamoDbEnhancedClient enhancedClient;

    @BeforeAll
    void init() {
        enhancedClient = LocalStackDynamo.enhancedClientWithTables(LOCALSTACK);
    }

    @Test
    @DisplayName("remind, extend, remind again, then delete")
    void fullLifecycle() {
        MutableClock clock = new MutableClock(NOW, ZoneOffset.UTC);
        StubMediaCatalog catalog = new StubMediaCatalog();
        RecordingMediaDeleter deleter = new RecordingMediaDeleter();
        RecordingLoanNotifier notifier = new RecordingLoanNotifier();
        LoanRequestAccess loans = new DynamoLoanRequestAccess(enhancedClient);
        ReminderAccess reminders = new DynamoReminderAccess(enhancedClient);
        DynamoJobRunAccess jobRuns = new DynamoJobRunAccess(enhancedClient);

        LoanPolicyProperties properties = new LoanPolicyProperties();
        properties.setExtensionBaseUrl("https://loans.example");
        PolicySettingsService policySettings =
                new PolicySettingsService(new DynamoSettingAccess(enhancedClient), properties, clock);
        JobRunner runner = new JobRunner(catalog, deleter, notifier, loans, reminders, new RetentionClock(),
                policySettings, new JobRunLogService(jobRuns, clock), clock);
        ExtensionLedger ledger = new ExtensionLedger(loans, policySettings, clock);

        catalog.addAvailable(11L, "Heat", "ann@example.com", NOW.minus(Duration.ofDays(24)));

        runner.run(JobType.CHECK, "cli");
        runner.run(JobType.CHECK, "cli");

        assertEquals(1, notifier.reminders().size());
        ReminderNotice first = notifier.reminders().get(0);
        assertEquals(6, first.daysLeft());
        assertEquals("https://loans.example/extend?request_id=11", first.extensionLink());
        assertTrue(reminders.exists(11L, "retention-30"));

        ledger.grantExtension(11L, "ann@example.com");

        clock.advance(Duration.ofDays(7));
        runner.run(JobType.PROCESS, "cron:nightly");

        assertEquals(2, notifier.reminders().size());
        assertEquals(6, notifier.reminders().get(1).daysLeft());
        assertTrue(reminders.exists(11L, "retention-37"));
        assertTrue(deleter.deleted().isEmpty());

        clock.advance(Duration.ofDays(6));
        JobRun last = runner.run(JobType.PROCESS, "cron:nightly");

        assertTrue(last.getSuccess());
        assertEquals(List.of(11L), deleter.deleted());
        assertEquals(List.of("ann@example.com:Heat"), notifier.deletionNotices());
        assertTrue(loans.findByRequestId(11L).isEmpty());
        assertFalse(reminders.exists(11L, "retention-30"));
        assertFalse(reminders.exists(11L, "retention-37"));
        assertEquals(4, jobRuns.findLatest(10).size());
    }
}
