package com.example.workscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the work scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "work-scheduler")
public class WorkSchedulerProperties {

    /**
     * Administrative switch; when false the loop never starts
     */
    private boolean enabled = true;

    /**
     * Time between scheduler ticks, e.g. {@code 5m}
     */
    @NotNull
    private Duration pollInterval = Duration.ofMinutes(5);

    /**
     * Lease validity in seconds. Must exceed the poll interval so a healthy
     * holder renews before expiry.
     */
    @Min(1)
    private int leaseDurationSeconds = 360;

    /**
     * Maximum number of due items dispatched per tick
     */
    @Min(1)
    private int batchSize = 50;

    /**
     * Consecutive failed ticks after which the loop disables itself
     */
    @Min(1)
    private int maxConsecutiveErrors = 10;

    /**
     * Grant the lease when the lock store cannot be read
     */
    private boolean failOpenOnLockStoreOutage = true;

    @NotBlank
    private String leaseKey = "scheduler-lock";

    @NotBlank
    private String leasePartition = "scheduler";

    /**
     * Seconds stop() waits for an in-flight tick before releasing resources
     */
    @Min(1)
    private int stopTimeoutSeconds = 30;

    /**
     * Threads used to persist next-run updates concurrently
     */
    @Min(1)
    private int updatePoolSize = 8;

    /**
     * Queue rows older than this are purged
     */
    @Min(1)
    private int jobQueueRetentionDays = 7;

    public Duration getLeaseDuration() {
        return Duration.ofSeconds(leaseDurationSeconds);
    }
}
