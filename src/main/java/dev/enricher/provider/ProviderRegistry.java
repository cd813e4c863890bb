package dev.enricher.provider;

import dev.enricher.config.ProvidersConfig;
import dev.enricher.entity.ProviderConfig;
import dev.enricher.exception.EnricherException;
import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.model.EntityType;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Catalog of registered providers and the single cached {@link ProviderInstance} per provider
 * configuration. Configuration changes reach a running instance only through
 * {@link #applyConfig(ProviderConfig)}.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<String, ProviderFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, ProviderInstance> instances = new ConcurrentHashMap<>();
    private final ProvidersConfig settings;
    private final EnricherMetrics metrics;

    public ProviderRegistry(ProvidersConfig settings, EnricherMetrics metrics) {
        this.settings = settings;
        this.metrics = metrics;
    }

    public void register(ProviderFactory factory) {
        ProviderCapabilities capabilities = factory.capabilities();
        String name = capabilities.providerName();
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalStateException("Provider already registered: " + name);
        }
        log.info("Registered provider {} (entity types: {}, asset types: {})",
                name, capabilities.entityTypes(), capabilities.assetTypes());
    }

    public boolean isRegistered(String providerName) {
        return factories.containsKey(providerName);
    }

    public Optional<ProviderCapabilities> getCapabilities(String providerName) {
        return Optional.ofNullable(factories.get(providerName)).map(ProviderFactory::capabilities);
    }

    public List<ProviderCapabilities> getAllCapabilities() {
        return factories.values().stream()
                .map(ProviderFactory::capabilities)
                .sorted(Comparator.comparing(ProviderCapabilities::providerName))
                .toList();
    }

    public List<String> getProvidersForEntityType(EntityType entityType) {
        return namesMatching(c -> c.supportsEntityType(entityType));
    }

    public List<String> getProvidersForAssetType(EntityType entityType, String assetType) {
        return namesMatching(c -> c.supportsEntityType(entityType) && c.supportsAssetType(assetType));
    }

    public List<String> getProvidersForMetadataField(EntityType entityType, String field) {
        return namesMatching(c -> c.supportsField(entityType, field));
    }

    public List<String> getProvidersForExternalId(String idType) {
        return namesMatching(c -> c.externalIdTypes().contains(idType));
    }

    /**
     * Returns the cached instance for this provider, creating it from the configuration on first use.
     */
    public ProviderInstance getInstance(ProviderConfig config) {
        String name = config.getProviderName();
        ProviderFactory factory = factories.get(name);
        if (factory == null) {
            throw new EnricherException("Provider not registered: " + name);
        }
        return instances.computeIfAbsent(name, key -> {
            log.debug("Creating provider instance for {}", key);
            return new ProviderInstance(factory, config, settings, metrics);
        });
    }

    public Optional<ProviderInstance> findInstance(String providerName) {
        return Optional.ofNullable(instances.get(providerName));
    }

    /**
     * Pushes an updated configuration into the cached instance, creating it if absent.
     */
    public ProviderInstance applyConfig(ProviderConfig config) {
        ProviderInstance existing = instances.get(config.getProviderName());
        if (existing == null) {
            return getInstance(config);
        }
        existing.applyConfig(config);
        return existing;
    }

    public void invalidate(String providerName) {
        if (instances.remove(providerName) != null) {
            log.debug("Dropped cached instance for {}", providerName);
        }
    }

    public void clear() {
        instances.clear();
    }

    private List<String> namesMatching(Predicate<ProviderCapabilities> filter) {
        return factories.values().stream()
                .map(ProviderFactory::capabilities)
                .filter(filter)
                .map(ProviderCapabilities::providerName)
                .sorted()
                .toList();
    }
}
