package com.example.loankeeper.config;

import com.example.loankeeper.catalog.LoanNotifier;
import com.example.loankeeper.catalog.LoggingLoanNotifier;
import com.example.loankeeper.catalog.MediaCatalog;
import com.example.loankeeper.catalog.MediaDeleter;
import com.example.loankeeper.catalog.UnconfiguredMediaCatalog;
import com.example.loankeeper.catalog.UnconfiguredMediaDeleter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback beans for the external collaborators. A deployment provides its own catalog client,
 * deleter and mail notifier as beans; these only apply when none is registered.
 */
@Configuration
@Slf4j
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public MediaCatalog mediaCatalog() {
        log.warn("No MediaCatalog bean configured, check and process runs will fail");
        return new UnconfiguredMediaCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public MediaDeleter mediaDeleter() {
        log.warn("No MediaDeleter bean configured, deletions will be recorded as failures");
        return new UnconfiguredMediaDeleter();
    }

    @Bean
    @ConditionalOnMissingBean
    public LoanNotifier loanNotifier() {
        return new LoggingLoanNotifier();
    }
}
