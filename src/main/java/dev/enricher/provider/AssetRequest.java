package dev.enricher.provider;

import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.RequestPriority;

import java.util.Set;

public record AssetRequest(EnrichmentTarget target, Set<String> assetTypes, RequestPriority priority) {
}
