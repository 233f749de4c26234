package com.example.loankeeper.models;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.example.loankeeper.service.LoanKeeperException;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PolicyConfigTest {

    @Test
    void reminderWindowMustFitInsideRetention() {
        LoanKeeperException ex = assertThrows(LoanKeeperException.class,
                () -> new PolicyConfig(7, 7, 7, "https://x", ZoneOffset.UTC));
        assertEquals(LoanKeeperException.Code.CONFIG_ERROR, ex.getCode());
    }

    @Test
    void nonPositiveDaysRejected() {
        assertThrows(LoanKeeperException.class, () -> new PolicyConfig(0, 1, 7, "https://x", ZoneOffset.UTC));
        assertThrows(LoanKeeperException.class, () -> new PolicyConfig(30, 0, 7, "https://x", ZoneOffset.UTC));
        assertThrows(LoanKeeperException.class, () -> new PolicyConfig(30, 7, 0, "https://x", ZoneOffset.UTC));
    }

    @Test
    void extensionLinkDropsTrailingSlashes() {
        PolicyConfig policy = new PolicyConfig(30, 7, 7, "https://loans.example.com//", ZoneOffset.UTC);

        assertEquals("https://loans.example.com/extend?request_id=42", policy.extensionLink(42));
    }
}
