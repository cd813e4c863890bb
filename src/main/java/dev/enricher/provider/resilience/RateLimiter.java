package dev.enricher.provider.resilience;

import dev.enricher.model.RequestPriority;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.function.Supplier;

/**
 * Sliding-window limiter for one provider.
 *
 * <p>Background traffic is held to {@code maxRequests} per window; webhook and user traffic may
 * go up to {@code burstCapacity}. A caller that finds the window full is delayed on a Reactor
 * timer until the oldest relevant request leaves the window; no thread is blocked.
 */
@Slf4j
public class RateLimiter {

    private static final long WAIT_PADDING_MS = 10;

    @Getter
    private final String name;
    private final int maxRequests;
    private final int burstCapacity;
    private final long windowMs;
    private final Deque<Long> timestamps = new ArrayDeque<>();

    public RateLimiter(String name, int requestsPerSecond, int burstCapacity, long windowMs) {
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be positive: " + requestsPerSecond);
        }
        this.name = name;
        this.windowMs = windowMs > 0 ? windowMs : 1000;
        this.maxRequests = (int) Math.max(1, requestsPerSecond * this.windowMs / 1000);
        this.burstCapacity = Math.max(this.maxRequests, burstCapacity);
    }

    /**
     * Subscribes to the supplied call once a slot is free for the given priority.
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> call, RequestPriority priority) {
        return Mono.defer(() -> {
            long waitMs = tryAcquire(priority);
            if (waitMs <= 0) {
                return call.get();
            }
            log.debug("{} rate limit reached for {} request, waiting {}ms", name, priority, waitMs);
            return Mono.delay(Duration.ofMillis(waitMs)).then(execute(call, priority));
        });
    }

    /**
     * Takes a slot and returns 0, or returns how long to wait before asking again.
     */
    synchronized long tryAcquire(RequestPriority priority) {
        long now = now();
        evictExpired(now);

        int limit = priority.allowsBurst() ? burstCapacity : maxRequests;
        if (timestamps.size() < limit) {
            timestamps.addLast(now);
            return 0;
        }

        // The slot frees up when the request at position (size - limit) leaves the window.
        int skip = timestamps.size() - limit;
        Iterator<Long> it = timestamps.iterator();
        long blocking = it.next();
        for (int i = 0; i < skip; i++) {
            blocking = it.next();
        }
        return Math.max(1, blocking + windowMs - now + WAIT_PADDING_MS);
    }

    public synchronized RateLimiterStats getStats() {
        evictExpired(now());
        int inWindow = timestamps.size();
        return new RateLimiterStats(inWindow, maxRequests, Math.max(0, maxRequests - inWindow), burstCapacity);
    }

    public synchronized void reset() {
        timestamps.clear();
    }

    private void evictExpired(long now) {
        long windowStart = now - windowMs;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= windowStart) {
            timestamps.pollFirst();
        }
    }

    private static long now() {
        return System.nanoTime() / 1_000_000;
    }

    public record RateLimiterStats(int requestsInWindow, int maxRequests, int remainingRequests, int burstCapacity) {
    }
}
