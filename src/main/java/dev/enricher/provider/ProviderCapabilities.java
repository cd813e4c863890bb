package dev.enricher.provider;

import dev.enricher.model.EntityType;
import lombok.Builder;
import lombok.Singular;

import java.util.Map;
import java.util.Set;

/**
 * Declarative description of what a provider supports. Established once, when the provider's
 * factory is registered.
 *
 * @param metadataFields      fields the provider can supply, per entity type
 * @param externalIdTypes     id types the provider can look entities up by ({@code tmdb_id}, ...)
 * @param changeDetection     whether {@link MetadataProvider#getChangesSince} is implemented
 */
@Builder
public record ProviderCapabilities(
        String providerName,
        String displayName,
        @Singular Set<EntityType> entityTypes,
        @Singular Set<String> assetTypes,
        @Singular Map<EntityType, Set<String>> metadataFields,
        @Singular Set<String> externalIdTypes,
        boolean requiresApiKey,
        boolean changeDetection,
        RateLimit rateLimit,
        DataQuality dataQuality) {

    public ProviderCapabilities {
        if (rateLimit == null) {
            rateLimit = new RateLimit(10, 15, 1000);
        }
        if (dataQuality == null) {
            dataQuality = new DataQuality(0.5, 0.5);
        }
    }

    public boolean supportsEntityType(EntityType entityType) {
        return entityTypes.contains(entityType);
    }

    public boolean supportsAssetType(String assetType) {
        return assetTypes.contains(assetType);
    }

    public boolean supportsField(EntityType entityType, String field) {
        Set<String> fields = metadataFields.get(entityType);
        return fields != null && fields.contains(field);
    }

    /**
     * Requests allowed per sliding window. {@code burstCapacity} is only granted to webhook and
     * user traffic.
     */
    public record RateLimit(int requestsPerSecond, int burstCapacity, long windowMs) {
    }

    /**
     * Quality hints in [0, 1]; informational.
     */
    public record DataQuality(double metadataCompleteness, double imageQuality) {
    }
}
