package dev.enricher.queue.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.enricher.config.QueueConfig;
import dev.enricher.entity.Job;
import dev.enricher.model.JobType;
import dev.enricher.queue.JobHandler;
import dev.enricher.queue.JobQueueService;
import dev.enricher.service.AssetDownloader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Applies job history retention and removes stale download temp files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CleanupJobHandler implements JobHandler {

    private final JobQueueService queue;
    private final AssetDownloader downloader;
    private final QueueConfig queueConfig;

    @Override
    public JobType getType() {
        return JobType.SCHEDULED_CLEANUP;
    }

    @Override
    public Mono<String> handle(Job job, JsonNode payload) {
        return Mono.fromCallable(() -> {
            int history = queue.cleanupHistory(queueConfig.getCompletedRetentionDays(),
                    queueConfig.getFailedRetentionDays());
            int tempFiles = downloader.sweepStaleTempFiles();
            log.info("Cleanup (manual: {}): {} history rows, {} temp files removed",
                    payload.path("manual").asBoolean(false), history, tempFiles);
            return String.format("history %d, temp files %d", history, tempFiles);
        });
    }
}
