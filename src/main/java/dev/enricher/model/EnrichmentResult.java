package dev.enricher.model;

import java.util.List;
import java.util.Map;

/**
 * Aggregated output of one orchestration call.
 *
 * @param fields       merged metadata, by field name
 * @param fieldSources provider that supplied each merged field
 * @param assets       analysed asset candidates from every provider that answered
 */
public record EnrichmentResult(
        Map<String, Object> fields,
        Map<String, String> fieldSources,
        List<AnalyzedAsset> assets,
        List<String> completedProviders,
        List<String> failedProviders) {

    public boolean allFailed() {
        return completedProviders.isEmpty() && !failedProviders.isEmpty();
    }
}
