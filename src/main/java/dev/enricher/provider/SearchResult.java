package dev.enricher.provider;

/**
 * @param confidence match confidence in [0, 1]
 */
public record SearchResult(String providerName, String externalId, String title, Integer year, double confidence) {
}
