package dev.enricher.provider;

import dev.enricher.exception.ProviderNotSupportedException;
import dev.enricher.model.EnrichmentTarget;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Contract every concrete metadata provider implements. Only {@link #defineCapabilities()} is
 * mandatory; an operation a provider does not implement fails with
 * {@link ProviderNotSupportedException}.
 *
 * <p>Implementations only talk to their upstream API. Pacing, circuit breaking, retries and
 * timeouts are applied around them by {@link ProviderInstance}.
 */
public interface MetadataProvider {

    ProviderCapabilities defineCapabilities();

    default String getName() {
        return defineCapabilities().providerName();
    }

    default Mono<List<SearchResult>> search(SearchRequest request) {
        return Mono.error(new ProviderNotSupportedException(getName(), "search"));
    }

    default Mono<MetadataResponse> getMetadata(MetadataRequest request) {
        return Mono.error(new ProviderNotSupportedException(getName(), "getMetadata"));
    }

    default Mono<List<AssetInfo>> getAssets(AssetRequest request) {
        return Mono.error(new ProviderNotSupportedException(getName(), "getAssets"));
    }

    /**
     * Whether the entity changed upstream since the given instant.
     */
    default Mono<ChangesResponse> getChangesSince(EnrichmentTarget target, Instant since) {
        return Mono.error(new ProviderNotSupportedException(getName(), "getChangesSince"));
    }

    default Mono<ConnectionTestResult> testConnection() {
        return Mono.error(new ProviderNotSupportedException(getName(), "testConnection"));
    }
}
