package com.example.loankeeper.service;

import com.example.loankeeper.access.SettingAccess;
import com.example.loankeeper.config.LoanPolicyProperties;
import com.example.loankeeper.models.PolicyConfig;
import com.example.loankeeper.models.Setting;
import com.example.loankeeper.requests.UpdateRetentionSettingsServiceRequest;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves the retention policy from two tiers: a value stored in the {@code settings} table
 * wins, otherwise the environment-level {@link LoanPolicyProperties} value applies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PolicySettingsService {

    private final SettingAccess settingAccess;
    private final LoanPolicyProperties properties;
    private final Clock clock;

    /**
     * Snapshot of the current policy. Job runs call this once and pass the result along.
     */
    public PolicyConfig resolve() {
        return new PolicyConfig(
                resolveInt(Setting.RETENTION_DAYS, properties.getRetentionDays()),
                resolveInt(Setting.REMINDER_DAYS, properties.getReminderDays()),
                resolveInt(Setting.EXTENSION_DAYS, properties.getExtensionDays()),
                resolveString(Setting.EXTENSION_BASE_URL, properties.getExtensionBaseUrl()),
                zone());
    }

    /**
     * Stores the fields present in the request. The merged policy is validated first, so an
     * update that would leave {@code reminder_days >= retention_days} writes nothing.
     */
    public PolicyConfig update(UpdateRetentionSettingsServiceRequest request) {
        Objects.requireNonNull(request, "request");
        PolicyConfig current = resolve();
        PolicyConfig merged = new PolicyConfig(
                request.retentionDays() != null ? request.retentionDays() : current.retentionDays(),
                request.reminderDays() != null ? request.reminderDays() : current.reminderDays(),
                request.extensionDays() != null ? request.extensionDays() : current.extensionDays(),
                request.extensionBaseUrl() != null ? request.extensionBaseUrl() : current.extensionBaseUrl(),
                current.zone());

        long now = clock.millis();
        if (request.retentionDays() != null) {
            write(Setting.RETENTION_DAYS, String.valueOf(merged.retentionDays()), now);
        }
        if (request.reminderDays() != null) {
            write(Setting.REMINDER_DAYS, String.valueOf(merged.reminderDays()), now);
        }
        if (request.extensionDays() != null) {
            write(Setting.EXTENSION_DAYS, String.valueOf(merged.extensionDays()), now);
        }
        if (request.extensionBaseUrl() != null) {
            write(Setting.EXTENSION_BASE_URL, merged.extensionBaseUrl(), now);
        }
        log.info("Updated retention settings: retention={} reminder={} extension={}",
                merged.retentionDays(), merged.reminderDays(), merged.extensionDays());
        return merged;
    }

    private void write(String key, String value, long now) {
        settingAccess.put(Setting.builder().key(key).value(value).updatedAt(now).build());
    }

    private int resolveInt(String key, int fallback) {
        Optional<String> stored = settingAccess.findByKey(key).map(Setting::getValue);
        if (stored.isPresent()) {
            try {
                return Integer.parseInt(stored.get().trim());
            } catch (NumberFormatException ex) {
                log.warn("Invalid {} in settings table ({}), using environment value {}",
                        key, stored.get(), fallback);
            }
        }
        return fallback;
    }

    private String resolveString(String key, String fallback) {
        return settingAccess.findByKey(key)
                .map(Setting::getValue)
                .filter(v -> !v.isBlank())
                .orElse(fallback);
    }

    private ZoneId zone() {
        try {
            return ZoneId.of(properties.getZone());
        } catch (DateTimeException ex) {
            throw LoanKeeperException.configError("Invalid loan.policy.zone: " + properties.getZone());
        }
    }
}
