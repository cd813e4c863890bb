package dev.enricher.support;

import dev.enricher.provider.AssetInfo;
import dev.enricher.provider.AssetRequest;
import dev.enricher.provider.MetadataProvider;
import dev.enricher.provider.MetadataRequest;
import dev.enricher.provider.MetadataResponse;
import dev.enricher.provider.ProviderCapabilities;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider with canned answers that counts how often it is called.
 */
public class StubProvider implements MetadataProvider {

    private final ProviderCapabilities capabilities;
    private final AtomicInteger metadataCalls = new AtomicInteger();
    private final AtomicInteger assetCalls = new AtomicInteger();
    private volatile Mono<MetadataResponse> metadata = Mono.empty();
    private volatile Mono<List<AssetInfo>> assets = Mono.just(List.of());

    public StubProvider(ProviderCapabilities capabilities) {
        this.capabilities = capabilities;
    }

    public StubProvider withFields(Map<String, Object> fields) {
        this.metadata = Mono.just(new MetadataResponse(capabilities.providerName(), "949", fields, Instant.now()));
        return this;
    }

    public StubProvider withMetadataError(RuntimeException error) {
        this.metadata = Mono.error(error);
        return this;
    }

    public StubProvider withAssets(List<AssetInfo> assets) {
        this.assets = Mono.just(assets);
        return this;
    }

    public StubProvider withAssetError(RuntimeException error) {
        this.assets = Mono.error(error);
        return this;
    }

    public int metadataCalls() {
        return metadataCalls.get();
    }

    public int assetCalls() {
        return assetCalls.get();
    }

    @Override
    public ProviderCapabilities defineCapabilities() {
        return capabilities;
    }

    @Override
    public Mono<MetadataResponse> getMetadata(MetadataRequest request) {
        return Mono.defer(() -> {
            metadataCalls.incrementAndGet();
            return metadata;
        });
    }

    @Override
    public Mono<List<AssetInfo>> getAssets(AssetRequest request) {
        return Mono.defer(() -> {
            assetCalls.incrementAndGet();
            return assets;
        });
    }
}
