package dev.enricher.provider;

import dev.enricher.config.ProvidersConfig;
import dev.enricher.entity.ProviderConfig;
import dev.enricher.exception.AuthException;
import dev.enricher.exception.NotFoundException;
import dev.enricher.exception.ProviderNotSupportedException;
import dev.enricher.exception.RateLimitException;
import dev.enricher.exception.TransientProviderException;
import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.EntityType;
import dev.enricher.model.RequestPriority;
import dev.enricher.support.TestProviders;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderInstanceTest {

    private static final EnrichmentTarget TARGET =
            new EnrichmentTarget(EntityType.MOVIE, 1L, "Heat", 1995, Map.of("tmdb_id", "949"));

    private ProvidersConfig settings;
    private SimpleMeterRegistry meterRegistry;
    private ScriptedProvider provider;

    @BeforeEach
    void setUp() {
        settings = new ProvidersConfig();
        settings.setMaxRetries(2);
        settings.setRetryBaseDelayMs(1);
        settings.setRetryMaxDelayMs(10);
        settings.setTimeoutMs(500);
        meterRegistry = new SimpleMeterRegistry();
        provider = new ScriptedProvider();
    }

    private ProviderInstance instance() {
        ProviderCapabilities capabilities = TestProviders.movieCapabilities("tmdb", Set.of("title"), Set.of("poster"));
        return new ProviderInstance(TestProviders.factory(capabilities, provider),
                TestProviders.enabledConfig("tmdb"), settings, new EnricherMetrics(meterRegistry));
    }

    private MetadataRequest request() {
        return new MetadataRequest(TARGET, RequestPriority.USER);
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("Should retry transient failures and return the eventual answer")
        void shouldRetryTransientFailures() {
            provider.metadata = provider.failTimes(2, () -> new TransientProviderException("tmdb", 503, "unavailable", null));

            StepVerifier.create(instance().getMetadata(request()))
                    .assertNext(response -> assertThat(response.fields()).containsEntry("title", "Heat"))
                    .verifyComplete();

            assertThat(provider.calls).hasValue(3);
        }

        @Test
        @DisplayName("Should give up after the configured retries")
        void shouldGiveUpAfterMaxRetries() {
            provider.metadata = provider.failTimes(10, () -> new TransientProviderException("tmdb", "reset"));

            StepVerifier.create(instance().getMetadata(request()))
                    .expectError(TransientProviderException.class)
                    .verify();

            assertThat(provider.calls).hasValue(3);
        }

        @Test
        @DisplayName("Should retry a rate-limited call after the signalled cooldown")
        void shouldHonourRetryAfter() {
            provider.metadata = provider.failTimes(1, () -> new RateLimitException("tmdb", Duration.ofMillis(5)));

            StepVerifier.create(instance().getMetadata(request()))
                    .expectNextCount(1)
                    .verifyComplete();

            assertThat(provider.calls).hasValue(2);
        }

        @Test
        @DisplayName("Should not retry a not-found answer")
        void shouldNotRetryNotFound() {
            provider.metadata = provider.failTimes(10, () -> new NotFoundException("tmdb", "949"));

            StepVerifier.create(instance().getMetadata(request()))
                    .expectError(NotFoundException.class)
                    .verify();

            assertThat(provider.calls).hasValue(1);
        }

        @Test
        @DisplayName("Should use exponential backoff capped at the maximum delay")
        void shouldComputeBackoff() {
            settings.setRetryBaseDelayMs(100);
            settings.setRetryMaxDelayMs(350);
            ProviderInstance instance = instance();

            assertThat(instance.retryDelay(new TransientProviderException("tmdb", "x"), 0)).isEqualTo(Duration.ofMillis(100));
            assertThat(instance.retryDelay(new TransientProviderException("tmdb", "x"), 1)).isEqualTo(Duration.ofMillis(200));
            assertThat(instance.retryDelay(new TransientProviderException("tmdb", "x"), 2)).isEqualTo(Duration.ofMillis(350));
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("Should turn a hung call into a transient failure")
        void shouldTimeOut() {
            settings.setMaxRetries(0);
            settings.setTimeoutMs(50);
            provider.metadata = () -> Mono.never();

            StepVerifier.create(instance().getMetadata(request()))
                    .expectError(TransientProviderException.class)
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("Should mark the provider unhealthy on auth failure until reconfigured")
        void shouldMarkUnhealthyOnAuthFailure() {
            provider.metadata = provider.failTimes(1, () -> new AuthException("tmdb"));
            ProviderInstance instance = instance();

            StepVerifier.create(instance.getMetadata(request())).expectError(AuthException.class).verify();
            assertThat(instance.isHealthy()).isFalse();
            assertThat(instance.isAvailable()).isFalse();

            StepVerifier.create(instance.getMetadata(request())).expectError(AuthException.class).verify();
            assertThat(provider.calls).hasValue(1);

            ProviderConfig updated = TestProviders.enabledConfig("tmdb");
            updated.setApiKey("new-key");
            instance.applyConfig(updated);

            assertThat(instance.isHealthy()).isTrue();
            assertThat(instance.getConfig().getApiKey()).isEqualTo("new-key");
            StepVerifier.create(instance.getMetadata(request())).expectNextCount(1).verifyComplete();
        }

        @Test
        @DisplayName("Should report unsupported operations without counting them as failures")
        void shouldReportUnsupportedOperation() {
            ProviderInstance instance = instance();

            StepVerifier.create(instance.search(new SearchRequest(EntityType.MOVIE, "Heat", 1995, RequestPriority.USER)))
                    .expectErrorSatisfies(e -> assertThat(e)
                            .isInstanceOf(ProviderNotSupportedException.class)
                            .hasMessageContaining("not supported by this provider"))
                    .verify();

            assertThat(instance.getCircuitBreaker().getStats().failureCount()).isZero();
        }

        @Test
        @DisplayName("Should record call outcomes")
        void shouldRecordMetrics() {
            StepVerifier.create(instance().getMetadata(request())).expectNextCount(1).verifyComplete();

            assertThat(meterRegistry.counter("enricher_provider_calls_total", "provider", "tmdb", "outcome", "success")
                    .count()).isEqualTo(1.0);
        }
    }

    /**
     * Provider whose metadata answer is scripted per test.
     */
    static class ScriptedProvider implements MetadataProvider {

        final AtomicInteger calls = new AtomicInteger();
        Supplier<Mono<MetadataResponse>> metadata = this::success;

        @Override
        public ProviderCapabilities defineCapabilities() {
            return TestProviders.movieCapabilities("tmdb", Set.of("title"), Set.of("poster"));
        }

        @Override
        public Mono<MetadataResponse> getMetadata(MetadataRequest request) {
            calls.incrementAndGet();
            return metadata.get();
        }

        Mono<MetadataResponse> success() {
            return Mono.just(new MetadataResponse("tmdb", "949", Map.of("title", "Heat"), Instant.now()));
        }

        Supplier<Mono<MetadataResponse>> failTimes(int failures, Supplier<RuntimeException> error) {
            AtomicInteger remaining = new AtomicInteger(failures);
            return () -> remaining.getAndDecrement() > 0 ? Mono.error(error.get()) : success();
        }
    }
}
