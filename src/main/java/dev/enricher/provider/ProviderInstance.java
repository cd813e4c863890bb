package dev.enricher.provider;

import dev.enricher.config.ProvidersConfig;
import dev.enricher.entity.ProviderConfig;
import dev.enricher.exception.AuthException;
import dev.enricher.exception.ProviderException;
import dev.enricher.exception.RateLimitException;
import dev.enricher.exception.TransientProviderException;
import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.RequestPriority;
import dev.enricher.provider.resilience.CircuitBreaker;
import dev.enricher.provider.resilience.RateLimiter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * A configured provider together with its own rate limiter and circuit breaker.
 *
 * <p>Every call runs breaker, then limiter, then the provider with a hard timeout. Transient and
 * rate-limit failures are retried with exponential backoff, or after the cooldown the provider
 * signalled. An authentication failure marks the instance unhealthy until the registry applies
 * a new configuration.
 */
@Slf4j
public class ProviderInstance {

    @Getter
    private final String name;
    @Getter
    private final ProviderCapabilities capabilities;
    @Getter
    private final RateLimiter rateLimiter;
    @Getter
    private final CircuitBreaker circuitBreaker;

    private final ProviderFactory factory;
    private final ProvidersConfig settings;
    private final EnricherMetrics metrics;

    private volatile ProviderConfig config;
    private volatile MetadataProvider provider;
    private volatile boolean healthy = true;

    public ProviderInstance(ProviderFactory factory, ProviderConfig config, ProvidersConfig settings,
                            EnricherMetrics metrics) {
        this.factory = factory;
        this.capabilities = factory.capabilities();
        this.name = capabilities.providerName();
        this.settings = settings;
        this.metrics = metrics;

        ProviderCapabilities.RateLimit limit = capabilities.rateLimit();
        this.rateLimiter = new RateLimiter(name, limit.requestsPerSecond(), limit.burstCapacity(), limit.windowMs());
        this.circuitBreaker = new CircuitBreaker(name, settings.getCircuitThreshold(),
                Duration.ofMillis(settings.getCircuitResetTimeoutMs()));
        this.circuitBreaker.setOnOpen(() -> metrics.recordCircuitOpened(name));

        this.config = config;
        this.provider = factory.create(config);
    }

    /**
     * Swaps in a new configuration. Limiter and breaker state survive; the unhealthy flag is cleared.
     */
    public synchronized void applyConfig(ProviderConfig newConfig) {
        this.config = newConfig;
        this.provider = factory.create(newConfig);
        if (!healthy) {
            log.info("Provider {} reconfigured, marking healthy again", name);
        }
        this.healthy = true;
    }

    public ProviderConfig getConfig() {
        return config;
    }

    public boolean isEnabled() {
        return config.isEnabled();
    }

    public boolean isHealthy() {
        return healthy;
    }

    /**
     * Whether the orchestrator should try this provider at all.
     */
    public boolean isAvailable() {
        return isEnabled() && healthy && !circuitBreaker.isOpen();
    }

    public Mono<List<SearchResult>> search(SearchRequest request) {
        return call("search", () -> provider.search(request), request.priority());
    }

    public Mono<MetadataResponse> getMetadata(MetadataRequest request) {
        return call("getMetadata", () -> provider.getMetadata(request), request.priority());
    }

    public Mono<List<AssetInfo>> getAssets(AssetRequest request) {
        return call("getAssets", () -> provider.getAssets(request), request.priority());
    }

    public Mono<ChangesResponse> getChangesSince(EnrichmentTarget target, Instant since) {
        return call("getChangesSince", () -> provider.getChangesSince(target, since), RequestPriority.BACKGROUND);
    }

    /**
     * Bypasses breaker and retries so a user can check credentials of a tripped provider.
     */
    public Mono<ConnectionTestResult> testConnection() {
        return rateLimiter.execute(() -> provider.testConnection(), RequestPriority.USER)
                .timeout(Duration.ofMillis(settings.getTimeoutMs()));
    }

    private <T> Mono<T> call(String operation, Supplier<Mono<T>> supplier, RequestPriority priority) {
        long start = System.currentTimeMillis();
        Duration timeout = Duration.ofMillis(settings.getTimeoutMs());

        return Mono.defer(() -> {
                    if (!healthy) {
                        return Mono.<T>error(new AuthException(name));
                    }
                    return circuitBreaker.execute(() -> rateLimiter.execute(
                            () -> supplier.get().timeout(timeout, Mono.defer(() -> Mono.error(
                                    new TransientProviderException(name, operation + " timed out after " + timeout.toMillis() + "ms")))),
                            priority));
                })
                .retryWhen(retryPolicy(operation))
                .doOnError(AuthException.class, e -> markUnhealthy())
                .doOnSuccess(v -> metrics.recordProviderCall(name, "success"))
                .doOnError(e -> metrics.recordProviderCall(name, "error"))
                .doFinally(signal -> metrics.recordProviderLatency(name, System.currentTimeMillis() - start));
    }

    private Retry retryPolicy(String operation) {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable error = signal.failure();
            long attempt = signal.totalRetries();
            if (attempt >= settings.getMaxRetries() || !isRetryable(error)) {
                return Mono.error(error);
            }
            Duration delay = retryDelay(error, attempt);
            log.debug("{} {} failed ({}), retry {} in {}ms", name, operation, error.getMessage(),
                    attempt + 1, delay.toMillis());
            return Mono.delay(delay);
        }));
    }

    Duration retryDelay(Throwable error, long attempt) {
        if (error instanceof RateLimitException rateLimit && rateLimit.getRetryAfter() != null) {
            return rateLimit.getRetryAfter();
        }
        long base = settings.getRetryBaseDelayMs();
        long delay = base * (1L << Math.min(attempt, 20));
        return Duration.ofMillis(Math.min(delay, settings.getRetryMaxDelayMs()));
    }

    private static boolean isRetryable(Throwable error) {
        return error instanceof ProviderException providerError && providerError.isRetryable();
    }

    private void markUnhealthy() {
        if (healthy) {
            log.error("Provider {} rejected its credentials; no further calls until reconfigured", name);
        }
        healthy = false;
    }
}
