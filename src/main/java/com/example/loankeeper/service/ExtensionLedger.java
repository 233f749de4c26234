package com.example.loankeeper.service;

import com.example.loankeeper.access.LoanRequestAccess;
import com.example.loankeeper.models.ExtensionGrant;
import com.example.loankeeper.models.LoanRequest;
import java.time.Clock;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Grants the single extension a loan is allowed. The grant adds the configured extension days
 * to the loan's retention window; {@code available_since} is left as it is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtensionLedger {

    private final LoanRequestAccess loanRequestAccess;
    private final PolicySettingsService policySettingsService;
    private final Clock clock;

    public LoanRequest grantExtension(long requestId, String grantedBy) {
        Objects.requireNonNull(grantedBy, "grantedBy");

        LoanRequest loan = loanRequestAccess.findByRequestId(requestId)
                .orElseThrow(() -> LoanKeeperException.requestNotFound(requestId));
        if (!loan.isAvailable()) {
            throw LoanKeeperException.notYetAvailable(requestId);
        }
        if (loan.isExtended()) {
            throw LoanKeeperException.alreadyExtended(requestId);
        }

        int days = policySettingsService.resolve().extensionDays();
        LoanRequest extended = loan.withExtension(new ExtensionGrant(clock.millis(), grantedBy, days));

        // conditional write: a concurrent grant that got there first makes this one a conflict
        if (!loanRequestAccess.saveExtension(extended)) {
            throw LoanKeeperException.alreadyExtended(requestId);
        }
        log.info("Extended request {} by {} days (granted by {})", requestId, days, grantedBy);
        return extended;
    }
}
