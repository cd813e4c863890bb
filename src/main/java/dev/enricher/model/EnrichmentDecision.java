package dev.enricher.model;

import java.util.List;

/**
 * Outcome of the staleness gate. The reason is part of the contract and is kept for auditing.
 */
public record EnrichmentDecision(boolean shouldEnrich, String reason, List<String> changedFields) {

    public EnrichmentDecision {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }

    public static EnrichmentDecision enrich(String reason) {
        return new EnrichmentDecision(true, reason, List.of());
    }

    public static EnrichmentDecision skip(String reason) {
        return new EnrichmentDecision(false, reason, List.of());
    }
}
