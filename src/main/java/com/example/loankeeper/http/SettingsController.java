package com.example.loankeeper.http;

import com.example.loankeeper.models.PolicyConfig;
import com.example.loankeeper.requests.UpdateRetentionSettingsHttpRequest;
import com.example.loankeeper.requests.UpdateRetentionSettingsServiceRequest;
import com.example.loankeeper.service.PolicySettingsService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SettingsController {

    private final PolicySettingsService policySettingsService;

    public SettingsController(PolicySettingsService policySettingsService) {
        this.policySettingsService = policySettingsService;
    }

    @GetMapping("/admin/settings/retention")
    public ResponseEntity<RetentionSettingsResponse> get() {
        return ResponseEntity.ok(map(policySettingsService.resolve()));
    }

    @PutMapping("/admin/settings/retention")
    public ResponseEntity<RetentionSettingsResponse> update(
            @Valid @RequestBody UpdateRetentionSettingsHttpRequest request) {
        PolicyConfig updated = policySettingsService.update(new UpdateRetentionSettingsServiceRequest(
                request.retentionDays(),
                request.reminderDays(),
                request.extensionDays(),
                request.extensionBaseUrl()));
        return ResponseEntity.ok(map(updated));
    }

    private RetentionSettingsResponse map(PolicyConfig policy) {
        return new RetentionSettingsResponse(
                policy.retentionDays(),
                policy.reminderDays(),
                policy.extensionDays(),
                policy.extensionBaseUrl(),
                policy.zone().getId()
        );
    }
}
