package dev.enricher.provider;

import dev.enricher.model.EntityType;
import dev.enricher.model.RequestPriority;

public record SearchRequest(EntityType entityType, String query, Integer year, RequestPriority priority) {
}
