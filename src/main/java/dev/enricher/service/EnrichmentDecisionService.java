package dev.enricher.service;

import dev.enricher.config.EnrichmentConfig;
import dev.enricher.model.EnrichmentDecision;
import dev.enricher.model.EnrichmentTarget;
import dev.enricher.provider.ChangesResponse;
import dev.enricher.provider.ProviderInstance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether an entity is worth enriching again. Every decision carries a reason string,
 * which is recorded with the job result.
 *
 * <p>Rules, first match wins:
 * <ol>
 *   <li>no external id: enrich ({@code no_external_id})</li>
 *   <li>never scraped: enrich ({@code never_scraped})</li>
 *   <li>age at least {@code forceRescrapeAfterDays}: enrich ({@code data_stale_N_days})</li>
 *   <li>age below {@code staleDataThresholdDays} with change detection available: ask the
 *       provider; skip when nothing changed, enrich when something did or the query failed</li>
 *   <li>age at least {@code staleDataThresholdDays}: enrich ({@code data_aged_N_days});
 *       otherwise skip ({@code recently_scraped_N_days_ago})</li>
 * </ol>
 * Unexpected errors favour freshness and enrich ({@code error_checking_status}).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnrichmentDecisionService {

    private final EnrichmentConfig config;
    private final ProviderConfigService providerConfigService;
    private final RefreshLogService refreshLogService;
    private final Clock clock;

    public EnrichmentDecision decide(EnrichmentTarget target, Instant lastScrapedAt) {
        try {
            EnrichmentDecision decision = evaluate(target, lastScrapedAt);
            log.debug("{} {}: {} ({})", target.entityType(), target.entityId(),
                    decision.shouldEnrich() ? "enrich" : "skip", decision.reason());
            return decision;
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Could not evaluate staleness of {} {}: {}", target.entityType(), target.entityId(),
                    e.getMessage());
            return EnrichmentDecision.enrich("error_checking_status");
        }
    }

    private EnrichmentDecision evaluate(EnrichmentTarget target, Instant lastScrapedAt) {
        if (!target.hasExternalId()) {
            return EnrichmentDecision.enrich("no_external_id");
        }
        if (lastScrapedAt == null) {
            return EnrichmentDecision.enrich("never_scraped");
        }

        long ageDays = Math.max(0, Duration.between(lastScrapedAt, clock.instant()).toDays());
        if (ageDays >= config.getForceRescrapeAfterDays()) {
            return EnrichmentDecision.enrich("data_stale_" + ageDays + "_days");
        }

        if (ageDays < config.getStaleDataThresholdDays() && config.isChangeDetectionEnabled()) {
            Optional<ProviderInstance> detector = findChangeDetector(target);
            if (detector.isPresent()) {
                return checkForChanges(detector.get(), target, lastScrapedAt);
            }
        }

        if (ageDays >= config.getStaleDataThresholdDays()) {
            return EnrichmentDecision.enrich("data_aged_" + ageDays + "_days");
        }
        return EnrichmentDecision.skip("recently_scraped_" + ageDays + "_days_ago");
    }

    private Optional<ProviderInstance> findChangeDetector(EnrichmentTarget target) {
        return providerConfigService.getEnabledInstances().stream()
                .filter(ProviderInstance::isAvailable)
                .filter(instance -> instance.getCapabilities().changeDetection())
                .filter(instance -> instance.getCapabilities().supportsEntityType(target.entityType()))
                .filter(instance -> instance.getCapabilities().externalIdTypes().stream()
                        .anyMatch(idType -> target.externalId(idType).isPresent()))
                .findFirst();
    }

    private EnrichmentDecision checkForChanges(ProviderInstance provider, EnrichmentTarget target, Instant since) {
        ChangesResponse changes;
        try {
            changes = provider.getChangesSince(target, since).block();
        } catch (RuntimeException e) {
            log.warn("Change detection via {} failed for {} {}: {}", provider.getName(), target.entityType(),
                    target.entityId(), e.getMessage());
            return EnrichmentDecision.enrich("change_detection_failed");
        }

        boolean changed = changes != null && changes.hasChanges();
        refreshLogService.recordCheck(target.entityType(), target.entityId(), provider.getName(), changed);
        if (!changed) {
            return EnrichmentDecision.skip("no_changes_since_last_scrape");
        }
        return new EnrichmentDecision(true, "changes_detected: " + String.join(", ", changes.changedFields()),
                changes.changedFields());
    }
}
