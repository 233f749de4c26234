package com.example.loankeeper.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the trigger loop (loan.scheduler.*).
 * Set loan.scheduler.enabled=false to keep schedules stored but never fired, e.g. for CLI use.
 */
@Component
@ConfigurationProperties(prefix = "loan.scheduler")
@Data
public class SchedulerProperties {

    private boolean enabled = true;
    private long tickIntervalMs = 30_000L;
    private Duration runTimeout = Duration.ofHours(2);
    private String zone = "UTC";
    private int workerThreads = 2;
}
