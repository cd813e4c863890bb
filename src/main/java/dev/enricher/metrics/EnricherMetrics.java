package dev.enricher.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the enrichment pipeline.
 */
@Component
public class EnricherMetrics {

    private static final String TAG_TYPE = "type";
    private static final String TAG_PROVIDER = "provider";
    private static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    // Cache counters
    private final Counter cacheStoredCounter;
    private final Counter cacheDeduplicatedCounter;
    private final Counter cacheReleasedCounter;

    // Asset analysis counters
    private final Counter assetsAnalyzedCounter;
    private final Counter assetsRejectedCounter;

    private final ConcurrentHashMap<String, Timer> jobTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> providerTimers = new ConcurrentHashMap<>();

    // Queue gauges, refreshed from queue statistics
    private final AtomicInteger pendingJobs = new AtomicInteger(0);
    private final AtomicInteger processingJobs = new AtomicInteger(0);
    private final AtomicInteger retryingJobs = new AtomicInteger(0);

    public EnricherMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.cacheStoredCounter = Counter.builder("enricher_cache_stored_total")
                .description("Distinct byte sequences written to the asset cache")
                .register(registry);

        this.cacheDeduplicatedCounter = Counter.builder("enricher_cache_deduplicated_total")
                .description("Stores answered by an existing cache entry")
                .register(registry);

        this.cacheReleasedCounter = Counter.builder("enricher_cache_released_total")
                .description("Cache entries deleted after their last reference was released")
                .register(registry);

        this.assetsAnalyzedCounter = Counter.builder("enricher_assets_analyzed_total")
                .description("Asset candidates downloaded and analysed")
                .register(registry);

        this.assetsRejectedCounter = Counter.builder("enricher_assets_rejected_total")
                .description("Asset candidates dropped because download or analysis failed")
                .register(registry);

        Gauge.builder("enricher_queue_pending", pendingJobs, AtomicInteger::get)
                .description("Jobs waiting to be claimed")
                .register(registry);

        Gauge.builder("enricher_queue_processing", processingJobs, AtomicInteger::get)
                .description("Jobs currently claimed by a worker")
                .register(registry);

        Gauge.builder("enricher_queue_retrying", retryingJobs, AtomicInteger::get)
                .description("Jobs waiting for their retry backoff")
                .register(registry);
    }

    public void recordJobEnqueued(String type) {
        Counter.builder("enricher_jobs_enqueued_total")
                .tag(TAG_TYPE, type)
                .register(registry)
                .increment();
    }

    /**
     * Record a job outcome: completed, retrying or failed.
     */
    public void recordJobOutcome(String type, String outcome) {
        Counter.builder("enricher_jobs_finished_total")
                .tag(TAG_TYPE, type)
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }

    public void recordJobDuration(String type, long durationMs) {
        jobTimers.computeIfAbsent(type, name ->
                Timer.builder("enricher_job_duration")
                        .description("Time from claim to completion of a job")
                        .tag(TAG_TYPE, name)
                        .register(registry)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Record a provider call outcome: success, error, skipped.
     */
    public void recordProviderCall(String provider, String outcome) {
        Counter.builder("enricher_provider_calls_total")
                .tag(TAG_PROVIDER, provider)
                .tag(TAG_OUTCOME, outcome)
                .register(registry)
                .increment();
    }

    public void recordProviderLatency(String provider, long latencyMs) {
        providerTimers.computeIfAbsent(provider, name ->
                Timer.builder("enricher_provider_call_duration")
                        .description("Latency of provider calls including retries")
                        .tag(TAG_PROVIDER, name)
                        .register(registry)
        ).record(Duration.ofMillis(latencyMs));
    }

    public void recordCircuitOpened(String provider) {
        Counter.builder("enricher_circuit_opened_total")
                .tag(TAG_PROVIDER, provider)
                .register(registry)
                .increment();
    }

    public void recordCacheStored() {
        cacheStoredCounter.increment();
    }

    public void recordCacheDeduplicated() {
        cacheDeduplicatedCounter.increment();
    }

    public void recordCacheReleased() {
        cacheReleasedCounter.increment();
    }

    public void recordAssetAnalyzed() {
        assetsAnalyzedCounter.increment();
    }

    public void recordAssetRejected() {
        assetsRejectedCounter.increment();
    }

    public void updateQueueDepth(int pending, int processing, int retrying) {
        pendingJobs.set(pending);
        processingJobs.set(processing);
        retryingJobs.set(retrying);
    }
}
