package com.example.loankeeper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Environment-level retention policy (loan.policy.*). These values are the fallback tier:
 * an admin setting stored in the {@code settings} table takes precedence field by field.
 * Environment variables bind through relaxed binding, e.g. LOAN_POLICY_RETENTION_DAYS.
 */
@Component
@ConfigurationProperties(prefix = "loan.policy")
@Data
public class LoanPolicyProperties {

    private int retentionDays = 30;
    private int reminderDays = 7;
    private int extensionDays = 7;
    private String extensionBaseUrl = "http://localhost:8080";
    private String zone = "UTC";
}
