package dev.zzpscanner.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic maintenance and reporting tasks. Setting {@code scanner.schedule.enabled}
 * to false leaves every {@code @Scheduled} method idle.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(
    prefix = "scanner.schedule",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulingConfig {}
