package dev.enricher.model;

import java.util.Map;

/**
 * Waterfall result: the first non-empty value per field and the provider that supplied it.
 * Fields no provider could supply are absent.
 */
public record ResolvedMetadata(Map<String, Object> fields, Map<String, String> fieldSources) {
}
