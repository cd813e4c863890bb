package dev.enricher.provider;

import dev.enricher.entity.ProviderConfig;

/**
 * Registers a provider with the {@link ProviderRegistry}. Declare one bean per provider.
 */
public interface ProviderFactory {

    ProviderCapabilities capabilities();

    /**
     * Builds a client for the given configuration (api key, enabled asset types).
     */
    MetadataProvider create(ProviderConfig config);

    default String getName() {
        return capabilities().providerName();
    }
}
