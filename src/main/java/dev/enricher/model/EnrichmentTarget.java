package dev.enricher.model;

import java.util.Map;
import java.util.Optional;

/**
 * The entity a fetch is performed for, with the external ids providers can look it up by
 * (keys such as {@code tmdb_id}, {@code imdb_id}).
 */
public record EnrichmentTarget(
        EntityType entityType,
        long entityId,
        String title,
        Integer year,
        Map<String, String> externalIds) {

    public EnrichmentTarget {
        externalIds = externalIds == null ? Map.of() : Map.copyOf(externalIds);
    }

    public Optional<String> externalId(String idType) {
        String value = externalIds.get(idType);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    public boolean hasExternalId() {
        return externalIds.values().stream().anyMatch(v -> v != null && !v.isBlank());
    }
}
