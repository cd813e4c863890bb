package dev.enricher.config;

import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.provider.ProviderFactory;
import dev.enricher.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Builds the provider registry from every {@link ProviderFactory} bean in the context.
 */
@Slf4j
@Configuration
public class ProviderRegistryConfig {

    @Bean
    public ProviderRegistry providerRegistry(ObjectProvider<ProviderFactory> factoryBeans, ProvidersConfig settings,
                                             EnricherMetrics metrics) {
        List<ProviderFactory> factories = factoryBeans.orderedStream().toList();
        ProviderRegistry registry = new ProviderRegistry(settings, metrics);
        factories.forEach(registry::register);
        if (factories.isEmpty()) {
            log.warn("No metadata providers registered; enrichment jobs will find nothing to fetch");
        }
        return registry;
    }
}
