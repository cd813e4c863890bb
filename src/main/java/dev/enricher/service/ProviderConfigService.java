package dev.enricher.service;

import dev.enricher.entity.ProviderConfig;
import dev.enricher.exception.ValidationException;
import dev.enricher.provider.ConnectionTestResult;
import dev.enricher.provider.ProviderCapabilities;
import dev.enricher.provider.ProviderInstance;
import dev.enricher.provider.ProviderRegistry;
import dev.enricher.repository.ProviderConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistent provider settings. Every change is pushed into the registry's cached instance.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderConfigService {

    private final ProviderConfigRepository repository;
    private final ProviderRegistry registry;
    private final Clock clock;

    /**
     * Create a configuration row for each registered provider that has none yet. Providers that
     * need no api key start enabled.
     *
     * @return number of rows created
     */
    @Transactional
    public int syncRegisteredProviders() {
        int created = 0;
        for (ProviderCapabilities capabilities : registry.getAllCapabilities()) {
            if (repository.findByProviderName(capabilities.providerName()).isPresent()) {
                continue;
            }
            repository.save(ProviderConfig.builder()
                    .providerName(capabilities.providerName())
                    .enabled(!capabilities.requiresApiKey())
                    .enabledAssetTypes(new ArrayList<>())
                    .updatedAt(clock.instant())
                    .build());
            created++;
            log.info("Created default configuration for provider {}", capabilities.providerName());
        }
        return created;
    }

    public List<ProviderConfig> listConfigs() {
        return repository.findAll();
    }

    public Optional<ProviderConfig> getConfig(String providerName) {
        return repository.findByProviderName(providerName);
    }

    @Transactional
    public ProviderConfig update(String providerName, ProviderConfigUpdate update) {
        ProviderCapabilities capabilities = registry.getCapabilities(providerName)
                .orElseThrow(() -> new ValidationException("Unknown provider: " + providerName));
        ProviderConfig config = repository.findByProviderName(providerName)
                .orElseGet(() -> ProviderConfig.builder().providerName(providerName).build());

        if (update.enabledAssetTypes() != null) {
            List<String> unsupported = update.enabledAssetTypes().stream()
                    .filter(type -> !capabilities.supportsAssetType(type))
                    .toList();
            if (!unsupported.isEmpty()) {
                throw new ValidationException(providerName + " does not provide asset types " + unsupported);
            }
            config.setEnabledAssetTypes(new ArrayList<>(update.enabledAssetTypes()));
        }
        if (update.apiKey() != null) {
            config.setApiKey(update.apiKey().isBlank() ? null : update.apiKey());
        }
        if (update.enabled() != null) {
            if (update.enabled() && capabilities.requiresApiKey() && config.getApiKey() == null) {
                throw new ValidationException(providerName + " requires an api key before it can be enabled");
            }
            config.setEnabled(update.enabled());
        }
        config.setUpdatedAt(clock.instant());

        ProviderConfig saved = repository.save(config);
        registry.applyConfig(saved);
        log.info("Updated configuration of provider {} (enabled: {})", providerName, saved.isEnabled());
        return saved;
    }

    /**
     * Cached instances of enabled, registered providers.
     */
    public List<ProviderInstance> getEnabledInstances() {
        return repository.findByEnabledTrue().stream()
                .filter(config -> registry.isRegistered(config.getProviderName()))
                .map(registry::getInstance)
                .toList();
    }

    public Optional<ProviderInstance> getEnabledInstance(String providerName) {
        return repository.findByProviderName(providerName)
                .filter(ProviderConfig::isEnabled)
                .filter(config -> registry.isRegistered(config.getProviderName()))
                .map(registry::getInstance);
    }

    /**
     * Check the provider's credentials and record the outcome on its configuration.
     */
    @Transactional
    public ConnectionTestResult testConnection(String providerName) {
        ProviderConfig config = repository.findByProviderName(providerName)
                .orElseThrow(() -> new ValidationException("Unknown provider: " + providerName));

        ConnectionTestResult result;
        try {
            result = registry.getInstance(config).testConnection().block();
        } catch (RuntimeException e) {
            result = new ConnectionTestResult(false, e.getMessage());
        }
        if (result == null) {
            result = new ConnectionTestResult(false, "No response");
        }

        Instant now = clock.instant();
        config.setLastTestStatus(result.success() ? "success" : "failed: " + result.message());
        config.setLastTestedAt(now);
        config.setUpdatedAt(now);
        repository.save(config);
        if (result.success()) {
            registry.applyConfig(config);
        }
        log.info("Connection test for {}: {}", providerName, config.getLastTestStatus());
        return result;
    }

    /**
     * Partial update; null fields are left unchanged. A blank api key clears it.
     */
    public record ProviderConfigUpdate(Boolean enabled, String apiKey, List<String> enabledAssetTypes) {
    }
}
