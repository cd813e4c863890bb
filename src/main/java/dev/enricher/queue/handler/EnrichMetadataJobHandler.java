package dev.enricher.queue.handler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.enricher.config.EnrichmentConfig;
import dev.enricher.entity.Job;
import dev.enricher.entity.MediaItem;
import dev.enricher.exception.EnricherException;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.AnalyzedAsset;
import dev.enricher.model.EnrichmentDecision;
import dev.enricher.model.EnrichmentResult;
import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.EntityType;
import dev.enricher.model.JobType;
import dev.enricher.model.RequestPriority;
import dev.enricher.model.ScoredAsset;
import dev.enricher.queue.JobHandler;
import dev.enricher.repository.MediaItemRepository;
import dev.enricher.service.AssetCandidateStore;
import dev.enricher.service.AssetScoringService;
import dev.enricher.service.EnrichmentDecisionService;
import dev.enricher.service.FetchOrchestrator;
import dev.enricher.service.FieldPriorityService;
import dev.enricher.service.RefreshLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the enrichment pipeline for one media item: staleness gate, provider fetch, metadata
 * merge, asset scoring and candidate storage.
 *
 * <p>Payload: {@code {"entityType": "movie", "entityId": 42, "source": "webhook"}}; {@code source}
 * is optional and selects the provider request priority (default background).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnrichMetadataJobHandler implements JobHandler {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final MediaItemRepository mediaItemRepository;
    private final EnrichmentDecisionService decisionService;
    private final FetchOrchestrator orchestrator;
    private final FieldPriorityService priorityService;
    private final AssetScoringService scoringService;
    private final AssetCandidateStore candidateStore;
    private final RefreshLogService refreshLogService;
    private final EnrichmentConfig config;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public JobType getType() {
        return JobType.ENRICH_METADATA;
    }

    @Override
    public Mono<String> handle(Job job, JsonNode payload) {
        return Mono.fromCallable(() -> run(payload));
    }

    private String run(JsonNode payload) {
        EntityType entityType = EntityType.parse(payload.path("entityType").asText())
                .orElseThrow(() -> new ValidationException("Unknown entity type: " + payload.path("entityType")));
        long entityId = payload.path("entityId").asLong();
        RequestPriority priority = requestPriority(payload);

        MediaItem item = mediaItemRepository.findById(entityId)
                .filter(found -> found.getEntityType() == entityType)
                .orElseThrow(() -> new ValidationException(entityType + " " + entityId + " does not exist"));
        EnrichmentTarget target = item.toTarget();

        EnrichmentDecision decision = decisionService.decide(target, item.getLastScrapedAt());
        if (!decision.shouldEnrich()) {
            log.info("Skipping {} {} ({})", entityType, entityId, decision.reason());
            return "skipped: " + decision.reason();
        }

        EnrichmentResult result = orchestrator.enrich(target, config.getMetadataFields(), config.getAssetTypes(),
                priority).block();
        if (result == null || result.allFailed()) {
            throw new EnricherException("All providers failed for " + entityType + " " + entityId
                    + (result == null ? "" : ": " + result.failedProviders()));
        }

        List<AnalyzedAsset> unsaved = new ArrayList<>(result.assets());
        int candidates;
        try {
            saveMetadata(item, result);
            candidates = saveCandidates(target, unsaved);
        } finally {
            orchestrator.release(unsaved);
        }
        result.completedProviders().forEach(provider ->
                refreshLogService.recordCheck(entityType, entityId, provider, false));

        log.info("Enriched {} {} ({}): {} fields, {} asset candidates, providers ok {} failed {}",
                entityType, entityId, decision.reason(), result.fields().size(), candidates,
                result.completedProviders(), result.failedProviders());
        return String.format("enriched (%s): %d fields, %d candidates", decision.reason(), result.fields().size(),
                candidates);
    }

    private void saveMetadata(MediaItem item, EnrichmentResult result) {
        Map<String, Object> merged = new LinkedHashMap<>(readMetadata(item));
        merged.putAll(result.fields());
        try {
            item.setMetadata(objectMapper.writeValueAsString(merged));
        } catch (JsonProcessingException e) {
            throw new EnricherException("Could not serialise metadata of " + item.getEntityType() + " " + item.getId(), e);
        }
        item.setLastScrapedAt(clock.instant());
        mediaItemRepository.save(item);
    }

    private Map<String, Object> readMetadata(MediaItem item) {
        if (item.getMetadata() == null || item.getMetadata().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(item.getMetadata(), METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable metadata of {} {}: {}", item.getEntityType(), item.getId(), e.getMessage());
            return Map.of();
        }
    }

    /**
     * Save candidates per configured asset type. Assets handed to the candidate store are removed
     * from {@code unsaved}.
     */
    private int saveCandidates(EnrichmentTarget target, List<AnalyzedAsset> unsaved) {
        int saved = 0;
        for (String assetType : config.getAssetTypes()) {
            List<AnalyzedAsset> ofType = unsaved.stream()
                    .filter(asset -> assetType.equals(asset.source().assetType()))
                    .toList();
            if (ofType.isEmpty()) {
                continue;
            }
            List<String> order = priorityService.getAssetTypeOrder(target.entityType(), assetType);
            List<ScoredAsset> scored = scoringService.scoreAll(ofType, order);
            unsaved.removeAll(ofType);
            saved += candidateStore.saveCandidates(target, assetType, scored).size();
        }
        return saved;
    }

    private static RequestPriority requestPriority(JsonNode payload) {
        String source = payload.path("source").asText("");
        if (source.isBlank()) {
            return RequestPriority.BACKGROUND;
        }
        try {
            return RequestPriority.valueOf(source.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown request source '{}', using background priority", source);
            return RequestPriority.BACKGROUND;
        }
    }
}
