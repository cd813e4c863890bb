package dev.enricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Job queue and worker pool settings.
 * Loaded from application.yml under 'queue' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "queue")
public class QueueConfig {

    /**
     * Start the worker pool when the application starts.
     */
    private boolean autoStart = true;
    private int workers = 2;
    private long pollIntervalMs = 1000;

    private int maxRetries = 3;
    private long backoffBaseMs = 1000;
    private long backoffMaxMs = 300_000;

    private int stuckJobThresholdMinutes = 5;

    /**
     * How often a worker refreshes the heartbeat of the job it is running. Must stay well below
     * the stuck-job threshold.
     */
    private long heartbeatIntervalMs = 30_000;

    /**
     * Consecutive storage failures after which a worker pauses.
     */
    private int infrastructureFailureLimit = 5;
    private long infrastructurePauseMs = 60_000;

    /**
     * Run the periodic maintenance schedule (stuck-job sweep, temp sweep, scheduled jobs).
     */
    private boolean maintenanceEnabled = true;
    private String providerUpdateCron = "0 0 3 * * *";
    private String cleanupCron = "0 30 4 * * *";

    private int completedRetentionDays = 7;
    private int failedRetentionDays = 30;
}
