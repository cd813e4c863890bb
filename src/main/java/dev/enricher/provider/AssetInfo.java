package dev.enricher.provider;

/**
 * One asset a provider offers for an entity, before download.
 *
 * @param durationSeconds runtime reported by the provider for video assets, null otherwise
 */
public record AssetInfo(
        String providerName,
        String assetType,
        String url,
        Integer width,
        Integer height,
        String language,
        Double voteAverage,
        Integer voteCount,
        Integer durationSeconds) {

    public boolean isVideo() {
        return "trailer".equals(assetType);
    }
}
