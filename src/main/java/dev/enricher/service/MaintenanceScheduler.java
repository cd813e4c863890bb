package dev.enricher.service;

import dev.enricher.model.JobPriority;
import dev.enricher.model.JobType;
import dev.enricher.queue.JobQueueService;
import dev.enricher.queue.QueueStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Periodic upkeep. Heavy work is enqueued as jobs so it runs on the worker pool with retries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "queue", name = "maintenance-enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceScheduler {

    private final JobQueueService queue;
    private final AssetDownloader downloader;

    @Scheduled(cron = "${queue.provider-update-cron:0 0 3 * * *}")
    public void scheduleProviderUpdate() {
        long id = queue.enqueue(JobType.SCHEDULED_PROVIDER_UPDATE, Map.of("manual", false), JobPriority.LOW);
        log.info("Scheduled provider update enqueued as job {}", id);
    }

    @Scheduled(cron = "${queue.cleanup-cron:0 30 4 * * *}")
    public void scheduleCleanup() {
        long id = queue.enqueue(JobType.SCHEDULED_CLEANUP, Map.of("manual", false), JobPriority.LOW);
        log.info("Scheduled cleanup enqueued as job {}", id);
    }

    @Scheduled(initialDelay = 60_000, fixedDelay = 60_000)
    public void recoverStuckJobs() {
        queue.recoverStuckJobs();
    }

    @Scheduled(initialDelay = 300_000, fixedDelay = 900_000)
    public void sweepTempFiles() {
        downloader.sweepStaleTempFiles();
    }

    @Scheduled(initialDelay = 30_000, fixedDelay = 30_000)
    public void refreshQueueStats() {
        QueueStats stats = queue.getStats();
        log.debug("Queue: {} pending, {} processing, {} retrying", stats.pending(), stats.processing(),
                stats.retrying());
    }
}
