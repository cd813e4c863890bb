package dev.enricher.service;

import dev.enricher.config.CacheConfig;
import dev.enricher.config.ProvidersConfig;
import dev.enricher.exception.CircuitOpenException;
import dev.enricher.exception.NotFoundException;
import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.model.AnalyzedAsset;
import dev.enricher.model.EnrichmentResult;
import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.RequestPriority;
import dev.enricher.model.ResolvedMetadata;
import dev.enricher.provider.AssetInfo;
import dev.enricher.provider.AssetRequest;
import dev.enricher.provider.MetadataRequest;
import dev.enricher.provider.MetadataResponse;
import dev.enricher.provider.ProviderInstance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Queries providers for one entity.
 *
 * <p>Metadata fields are resolved as a waterfall: providers are asked in priority order and the
 * first non-empty value wins. Assets are collected from every capable provider concurrently and
 * every candidate is kept. Provider errors never abort a fetch; they only remove that
 * provider's contribution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FetchOrchestrator {

    private final ProviderConfigService providerConfigService;
    private final FieldPriorityService priorityService;
    private final AssetAnalysisService analysisService;
    private final ProvidersConfig providersConfig;
    private final CacheConfig cacheConfig;
    private final EnricherMetrics metrics;

    /**
     * Metadata and analysed asset candidates in one call. The caller owns the cache references of
     * the returned assets.
     */
    public Mono<EnrichmentResult> enrich(EnrichmentTarget target, Collection<String> fields,
                                         Collection<String> assetTypes, RequestPriority priority) {
        return Mono.defer(() -> {
            FetchContext context = new FetchContext(target, priority);
            Mono<ResolvedMetadata> metadata = resolveMetadata(context, fields);
            Mono<List<AnalyzedAsset>> assets = analyze(fetchAssets(context, assetTypes))
                    .collectList()
                    .doOnDiscard(AnalyzedAsset.class, analysisService::release);

            return Mono.zip(metadata, assets).map(tuple -> new EnrichmentResult(
                    tuple.getT1().fields(),
                    tuple.getT1().fieldSources(),
                    tuple.getT2(),
                    List.copyOf(context.completed),
                    context.failed.stream().filter(name -> !context.completed.contains(name)).toList()));
        });
    }

    public Mono<ResolvedMetadata> resolveMetadata(EnrichmentTarget target, Collection<String> fields,
                                                  RequestPriority priority) {
        return Mono.defer(() -> resolveMetadata(new FetchContext(target, priority), fields));
    }

    public Flux<AssetInfo> fetchAssets(EnrichmentTarget target, Collection<String> assetTypes,
                                       RequestPriority priority) {
        return Flux.defer(() -> fetchAssets(new FetchContext(target, priority), assetTypes));
    }

    /**
     * Download, analyse and cache candidates with bounded parallelism. A candidate whose download
     * or analysis fails is dropped. Each emitted asset holds a cache reference the subscriber must
     * hand to a candidate or {@link #release}.
     */
    public Flux<AnalyzedAsset> analyze(Flux<AssetInfo> candidates) {
        return candidates.flatMap(info -> analysisService.analyze(info)
                        .doOnNext(asset -> metrics.recordAssetAnalyzed())
                        .onErrorResume(e -> {
                            log.debug("Dropping {} asset {} from {}: {}", info.assetType(), info.url(),
                                    info.providerName(), e.getMessage());
                            metrics.recordAssetRejected();
                            return Mono.empty();
                        }),
                Math.max(1, cacheConfig.getAnalysisConcurrency()));
    }

    public void release(Collection<AnalyzedAsset> assets) {
        assets.forEach(analysisService::release);
    }

    private Mono<ResolvedMetadata> resolveMetadata(FetchContext context, Collection<String> fields) {
        Map<String, List<String>> orders = new LinkedHashMap<>();
        for (String field : new LinkedHashSet<>(fields)) {
            orders.put(field, priorityService.getMetadataFieldOrder(context.target.entityType(), field));
        }
        return Flux.fromIterable(orders.entrySet())
                .concatMap(entry -> resolveField(context, entry.getKey(), entry.getValue()))
                .collectList()
                .map(values -> {
                    Map<String, Object> resolved = new LinkedHashMap<>();
                    Map<String, String> sources = new LinkedHashMap<>();
                    for (FieldValue value : values) {
                        resolved.put(value.field(), value.value());
                        sources.put(value.field(), value.provider());
                    }
                    return new ResolvedMetadata(resolved, sources);
                });
    }

    private Mono<FieldValue> resolveField(FetchContext context, String field, List<String> order) {
        return Flux.fromIterable(order)
                .concatMap(name -> context.metadataFrom(name)
                        .flatMap(response -> response.hasField(field)
                                ? Mono.just(new FieldValue(field, response.fields().get(field), name))
                                : Mono.empty()))
                .next()
                .doOnSuccess(value -> {
                    if (value == null) {
                        log.debug("No provider supplied {} for {} {}", field, context.target.entityType(),
                                context.target.entityId());
                    }
                });
    }

    private Flux<AssetInfo> fetchAssets(FetchContext context, Collection<String> assetTypes) {
        Set<String> requested = new LinkedHashSet<>(assetTypes);
        List<ProviderInstance> capable = new ArrayList<>();
        for (ProviderInstance instance : context.instances.values()) {
            if (!instance.getCapabilities().supportsEntityType(context.target.entityType())) {
                continue;
            }
            if (requested.stream().anyMatch(type -> accepts(instance, type))) {
                capable.add(instance);
            }
        }

        return Flux.fromIterable(capable)
                .flatMap(instance -> {
                    if (!instance.isAvailable()) {
                        skip(context, instance, "getAssets");
                        return Flux.<AssetInfo>empty();
                    }
                    Set<String> types = new LinkedHashSet<>();
                    requested.stream().filter(type -> accepts(instance, type)).forEach(types::add);
                    return instance.getAssets(new AssetRequest(context.target, types, context.priority))
                            .doOnNext(assets -> context.completed.add(instance.getName()))
                            .flatMapMany(Flux::fromIterable)
                            .filter(asset -> types.contains(asset.assetType()))
                            .onErrorResume(e -> {
                                handleError(context, instance, "getAssets", e);
                                return Flux.empty();
                            });
                }, Math.max(1, providersConfig.getFetchConcurrency()));
    }

    private static boolean accepts(ProviderInstance instance, String assetType) {
        return instance.getCapabilities().supportsAssetType(assetType)
                && instance.getConfig().isAssetTypeEnabled(assetType);
    }

    private void skip(FetchContext context, ProviderInstance instance, String operation) {
        log.debug("Skipping {} for {}: {}", instance.getName(), operation,
                instance.isHealthy() ? "circuit open" : "unhealthy");
        metrics.recordProviderCall(instance.getName(), "skipped");
        context.failed.add(instance.getName());
    }

    private void handleError(FetchContext context, ProviderInstance instance, String operation, Throwable e) {
        if (e instanceof NotFoundException) {
            log.debug("{} has no {} result for {} {}", instance.getName(), operation,
                    context.target.entityType(), context.target.entityId());
            context.completed.add(instance.getName());
            return;
        }
        if (e instanceof CircuitOpenException) {
            log.debug("{} skipped for {}: circuit open", instance.getName(), operation);
        } else {
            log.warn("{} {} failed for {} {}: {}", instance.getName(), operation, context.target.entityType(),
                    context.target.entityId(), e.getMessage());
        }
        context.failed.add(instance.getName());
    }

    private record FieldValue(String field, Object value, String provider) {
    }

    /**
     * State of one orchestration call. Each provider's metadata is fetched at most once per call.
     */
    private final class FetchContext {

        private final EnrichmentTarget target;
        private final RequestPriority priority;
        private final Map<String, Mono<Optional<MetadataResponse>>> metadata = new ConcurrentHashMap<>();
        private final Set<String> completed = ConcurrentHashMap.newKeySet();
        private final Set<String> failed = ConcurrentHashMap.newKeySet();
        private final Map<String, ProviderInstance> instances = new LinkedHashMap<>();

        private FetchContext(EnrichmentTarget target, RequestPriority priority) {
            this.target = target;
            this.priority = priority;
            for (ProviderInstance instance : providerConfigService.getEnabledInstances()) {
                instances.put(instance.getName(), instance);
            }
        }

        private Mono<MetadataResponse> metadataFrom(String providerName) {
            ProviderInstance instance = instances.get(providerName);
            if (instance == null) {
                return Mono.empty();
            }
            return metadata.computeIfAbsent(providerName, name -> fetchMetadata(instance))
                    .flatMap(response -> response.map(Mono::just).orElseGet(Mono::empty));
        }

        private Mono<Optional<MetadataResponse>> fetchMetadata(ProviderInstance instance) {
            return Mono.defer(() -> {
                        if (!instance.isAvailable()) {
                            skip(this, instance, "getMetadata");
                            return Mono.just(Optional.<MetadataResponse>empty());
                        }
                        return instance.getMetadata(new MetadataRequest(target, priority))
                                .doOnNext(response -> completed.add(instance.getName()))
                                .map(Optional::of)
                                .defaultIfEmpty(Optional.<MetadataResponse>empty())
                                .onErrorResume(e -> {
                                    handleError(this, instance, "getMetadata", e);
                                    return Mono.just(Optional.<MetadataResponse>empty());
                                });
                    })
                    .cache();
        }
    }
}
