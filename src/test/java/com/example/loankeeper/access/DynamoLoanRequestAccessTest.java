package com.example.loankeeper.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.loankeeper.models.ExtensionGrant;
import com.example.loankeeper.models.LoanRequest;
import com.example.loankeeper.models.MediaType;
import com.example.loankeeper.models.Reminder;
import com.example.loankeeper.models.Setting;
import com.example.loankeeper.testutil.LocalStackDynamo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

/**
 * Loans, their reminder ledger and the settings table against LocalStack.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoLoanRequestAccessTest {

    private static final long NOW = 1711962000000L;

    @Container
    private static final LocalStackContainer LOCALSTACK = LocalStackDynamo.container();

    private DynamoDbEnhancedClient enhancedClient;
    private LoanRequestAccess loanRequestAccess;
    private ReminderAccess reminderAccess;
    private SettingAccess settingAccess;

    @BeforeAll
    void init() {
        enhancedClient = LocalStackDynamo.enhancedClientWithTables(LOCALSTACK);
        loanRequestAccess = new DynamoLoanRequestAccess(enhancedClient);
        reminderAccess = new DynamoReminderAccess(enhancedClient);
        settingAccess = new DynamoSettingAccess(enhancedClient);
    }

    @BeforeEach
    void cleanup() {
        var loans = enhancedClient.table(DynamoLoanRequestAccess.TABLE_NAME, TableSchema.fromBean(LoanRequest.class));
        loans.scan().items().forEach(loans::deleteItem);
        var reminders = enhancedClient.table(DynamoReminderAccess.TABLE_NAME, TableSchema.fromBean(Reminder.class));
        reminders.scan().items().forEach(reminders::deleteItem);
    }

    @Test
    @DisplayName("loan without availability or extension reads back with nulls")
    void pendingLoan() {
        loanRequestAccess.save(loan(1L, null));

        LoanRequest found = loanRequestAccess.findByRequestId(1L).orElseThrow();

        assertEquals(MediaType.TV, found.getMediaType());
        assertEquals("Dune", found.getTitle());
        assertNull(found.getAvailableSince());
        assertFalse(found.isExtended());
    }

    @Test
    @DisplayName("extension is written once; a second conditional write is rejected")
    void extensionWrittenOnce() {
        loanRequestAccess.save(loan(1L, NOW));
        LoanRequest stored = loanRequestAccess.findByRequestId(1L).orElseThrow();

        boolean first = loanRequestAccess.saveExtension(stored.withExtension(new ExtensionGrant(NOW, "ann@example.com", 7)));
        boolean second = loanRequestAccess.saveExtension(stored.withExtension(new ExtensionGrant(NOW + 1, "bob@example.com", 14)));

        assertTrue(first);
        assertFalse(second);
        ExtensionGrant grant = loanRequestAccess.findByRequestId(1L).orElseThrow().extension().orElseThrow();
        assertEquals("ann@example.com", grant.grantedBy());
        assertEquals(7, grant.days());
        assertEquals(NOW, loanRequestAccess.findByRequestId(1L).orElseThrow().getAvailableSince());
    }

    @Test
    @DisplayName("catalog merge keeps a concurrent extension and the first availability stamp")
    void mergeCatalogFieldsKeepsExtension() {
        LoanRequest snapshot = loan(3L, NOW);
        loanRequestAccess.mergeCatalogFields(snapshot);
        loanRequestAccess.saveExtension(loanRequestAccess.findByRequestId(3L).orElseThrow()
                .withExtension(new ExtensionGrant(NOW + 10, "ann@example.com", 7)));

        LoanRequest merged = loanRequestAccess.mergeCatalogFields(snapshot.toBuilder()
                .title("Dune: Part One")
                .availableSince(NOW + 5_000)
                .build());

        assertTrue(merged.isExtended());
        assertEquals("Dune: Part One", merged.getTitle());
        assertEquals(NOW, merged.getAvailableSince());
        LoanRequest stored = loanRequestAccess.findByRequestId(3L).orElseThrow();
        assertEquals("ann@example.com", stored.extension().orElseThrow().grantedBy());
        assertEquals(NOW, stored.getAvailableSince());
    }

    @Test
    @DisplayName("extension of a missing loan is rejected rather than creating it")
    void extensionOfMissingLoan() {
        boolean saved = loanRequestAccess.saveExtension(loan(9L, NOW).withExtension(new ExtensionGrant(NOW, "x", 7)));

        assertFalse(saved);
        assertTrue(loanRequestAccess.findByRequestId(9L).isEmpty());
    }

    @Test
    @DisplayName("reminders are tracked per window and removed with the loan")
    void reminders() {
        reminderAccess.put(Reminder.builder().requestId(1L).windowKey("retention-30").sentAt(NOW).email("a@x").build());
        reminderAccess.put(Reminder.builder().requestId(1L).windowKey("retention-37").sentAt(NOW).email("a@x").build());
        reminderAccess.put(Reminder.builder().requestId(2L).windowKey("retention-30").sentAt(NOW).email("b@x").build());

        assertTrue(reminderAccess.exists(1L, "retention-30"));
        assertFalse(reminderAccess.exists(1L, "retention-44"));

        reminderAccess.deleteAllForRequest(1L);

        assertFalse(reminderAccess.exists(1L, "retention-30"));
        assertFalse(reminderAccess.exists(1L, "retention-37"));
        assertTrue(reminderAccess.exists(2L, "retention-30"));
    }

    @Test
    @DisplayName("settings are stored by key")
    void settings() {
        settingAccess.put(Setting.builder().key(Setting.RETENTION_DAYS).value("45").updatedAt(NOW).build());

        assertEquals("45", settingAccess.findByKey(Setting.RETENTION_DAYS).orElseThrow().getValue());
        assertTrue(settingAccess.findByKey(Setting.REMINDER_DAYS).isEmpty());
    }

    private static LoanRequest loan(long requestId, Long availableSince) {
        return LoanRequest.builder()
                .requestId(requestId)
                .mediaType(MediaType.TV)
                .mediaId(500L)
                .externalServiceId(77L)
                .requestedBy("dee@example.com")
                .requestedAt(NOW - 86_400_000L)
                .firstSeenAt(NOW - 3_600_000L)
                .title("Dune")
                .availableSince(availableSince)
                .build();
    }
}
