package dev.enricher.queue.handler;

import com.fasterxml.jackson.databind.JsonNode;
import dev.enricher.config.EnrichmentConfig;
import dev.enricher.entity.Job;
import dev.enricher.entity.ProviderRefreshLog;
import dev.enricher.model.JobPriority;
import dev.enricher.model.JobType;
import dev.enricher.queue.JobHandler;
import dev.enricher.queue.JobQueueService;
import dev.enricher.service.RefreshLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Flags (entity, provider) pairs not checked within the stale threshold and enqueues one
 * low-priority enrichment job per affected entity.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderUpdateJobHandler implements JobHandler {

    private final RefreshLogService refreshLogService;
    private final JobQueueService queue;
    private final EnrichmentConfig config;
    private final Clock clock;

    @Override
    public JobType getType() {
        return JobType.SCHEDULED_PROVIDER_UPDATE;
    }

    @Override
    public Mono<String> handle(Job job, JsonNode payload) {
        return Mono.fromCallable(() -> {
            Instant cutoff = clock.instant().minus(Duration.ofDays(config.getStaleDataThresholdDays()));
            int flagged = refreshLogService.markStale(cutoff);

            Set<String> entities = new LinkedHashSet<>();
            for (ProviderRefreshLog entry : refreshLogService.findNeedingRefresh()) {
                String key = entry.getEntityType().name() + ":" + entry.getEntityId();
                if (entities.add(key)) {
                    queue.enqueue(JobType.ENRICH_METADATA, Map.of(
                            "entityType", entry.getEntityType().name().toLowerCase(),
                            "entityId", entry.getEntityId(),
                            "source", "background"), JobPriority.LOW);
                }
            }

            log.info("Provider update (manual: {}): {} entries flagged stale, {} enrichment jobs enqueued",
                    payload.path("manual").asBoolean(false), flagged, entities.size());
            return String.format("flagged %d, enqueued %d", flagged, entities.size());
        });
    }
}
