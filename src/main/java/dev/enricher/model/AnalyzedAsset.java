package dev.enricher.model;

import dev.enricher.provider.AssetInfo;

/**
 * A provider asset after download and analysis. Its content is already in the cache; the
 * holder owns one reference to {@code cacheAssetId} until a candidate row takes it over or the
 * reference is released.
 *
 * @param perceptualHash 64-bit average hash, null for non-images
 */
public record AnalyzedAsset(
        AssetInfo source,
        String contentHash,
        long cacheAssetId,
        String mimeType,
        Integer width,
        Integer height,
        Long perceptualHash,
        Integer durationSeconds) {

    public long area() {
        if (width == null || height == null) {
            return 0L;
        }
        return (long) width * height;
    }
}
