package com.example.loankeeper.http;

import com.example.loankeeper.models.ExtensionGrant;
import com.example.loankeeper.models.LoanRequest;
import com.example.loankeeper.requests.ExtensionHttpRequest;
import com.example.loankeeper.service.ExtensionLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Target of the extension link sent with reminders. Each loan can be extended once.
 */
@RestController
public class ExtensionController {

    private static final String ANONYMOUS = "link";

    private final ExtensionLedger extensionLedger;

    public ExtensionController(ExtensionLedger extensionLedger) {
        this.extensionLedger = extensionLedger;
    }

    @PostMapping("/requests/{requestId}/extension")
    public ResponseEntity<ExtensionResponse> extend(
            @PathVariable long requestId,
            @RequestBody(required = false) ExtensionHttpRequest request
    ) {
        String grantedBy = request != null && request.requestedBy() != null && !request.requestedBy().isBlank()
                ? request.requestedBy()
                : ANONYMOUS;

        LoanRequest loan = extensionLedger.grantExtension(requestId, grantedBy);
        ExtensionGrant grant = loan.extension()
                .orElseThrow(() -> new IllegalStateException("extension missing after grant"));
        return ResponseEntity.ok(new ExtensionResponse(
                loan.getRequestId(),
                true,
                grant.grantedAt(),
                grant.grantedBy(),
                grant.days(),
                loan.getTitle()
        ));
    }
}
