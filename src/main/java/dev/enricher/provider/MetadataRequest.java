package dev.enricher.provider;

import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.RequestPriority;

public record MetadataRequest(EnrichmentTarget target, RequestPriority priority) {
}
