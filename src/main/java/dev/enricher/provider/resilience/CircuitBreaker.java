package dev.enricher.provider.resilience;

import dev.enricher.exception.CircuitOpenException;
import dev.enricher.exception.NotFoundException;
import dev.enricher.exception.ProviderNotSupportedException;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per-provider breaker. {@code threshold} consecutive failures open it; after the reset timeout
 * a single trial call is admitted, whose outcome closes or re-opens the circuit. Calls admitted
 * while the circuit was still closed may finish after it opened; their outcomes do not change
 * the state.
 *
 * <p>Not-found and not-supported errors are answers, not outages, and do not count as failures.
 */
@Slf4j
public class CircuitBreaker {

    private static final Predicate<Throwable> DEFAULT_FAILURE_PREDICATE =
            e -> !(e instanceof NotFoundException) && !(e instanceof ProviderNotSupportedException);

    @Getter
    private final String name;
    private final int threshold;
    private final Duration resetTimeout;
    private final Clock clock;
    private final Predicate<Throwable> isFailure;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant openedAt;
    private Instant lastFailureAt;
    private boolean trialInFlight;

    @Setter
    private Runnable onOpen = () -> { };
    @Setter
    private Runnable onClose = () -> { };
    @Setter
    private Runnable onHalfOpen = () -> { };

    public CircuitBreaker(String name, int threshold, Duration resetTimeout) {
        this(name, threshold, resetTimeout, Clock.systemUTC(), DEFAULT_FAILURE_PREDICATE);
    }

    public CircuitBreaker(String name, int threshold, Duration resetTimeout, Clock clock,
                          Predicate<Throwable> isFailure) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.name = name;
        this.threshold = threshold;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
        this.isFailure = isFailure;
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> call) {
        return Mono.defer(() -> {
            Admission admission = admit();
            if (admission == Admission.REJECTED) {
                return Mono.error(new CircuitOpenException(name));
            }
            boolean trial = admission == Admission.TRIAL;
            return Mono.defer(call)
                    .doOnSuccess(value -> recordSuccess(trial))
                    .doOnError(error -> recordError(error, trial))
                    .doOnCancel(() -> {
                        if (trial) {
                            releaseTrial();
                        }
                    });
        });
    }

    public synchronized boolean isOpen() {
        return state == CircuitState.OPEN && !resetTimeoutElapsed();
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(state, failureCount, threshold, lastFailureAt);
    }

    public void reset() {
        boolean wasClosed;
        synchronized (this) {
            wasClosed = state == CircuitState.CLOSED;
            state = CircuitState.CLOSED;
            failureCount = 0;
            openedAt = null;
            trialInFlight = false;
        }
        if (!wasClosed) {
            log.info("Circuit breaker for {} reset", name);
            onClose.run();
        }
    }

    private Admission admit() {
        boolean halfOpened = false;
        Admission admission;
        synchronized (this) {
            if (state == CircuitState.OPEN && resetTimeoutElapsed()) {
                state = CircuitState.HALF_OPEN;
                trialInFlight = false;
                halfOpened = true;
            }
            if (state == CircuitState.CLOSED) {
                admission = Admission.ALLOWED;
            } else if (state == CircuitState.HALF_OPEN && !trialInFlight) {
                trialInFlight = true;
                admission = Admission.TRIAL;
            } else {
                admission = Admission.REJECTED;
            }
        }
        if (halfOpened) {
            log.info("Circuit breaker for {} is half-open, admitting a trial call", name);
            onHalfOpen.run();
        }
        return admission;
    }

    private void recordSuccess(boolean trial) {
        boolean closed;
        synchronized (this) {
            if (!trial && state != CircuitState.CLOSED) {
                return;
            }
            closed = state != CircuitState.CLOSED;
            state = CircuitState.CLOSED;
            failureCount = 0;
            openedAt = null;
            trialInFlight = false;
        }
        if (closed) {
            log.info("Circuit breaker for {} closed after successful trial", name);
            onClose.run();
        }
    }

    private void recordError(Throwable error, boolean trial) {
        if (!isFailure.test(error)) {
            recordSuccess(trial);
            return;
        }
        boolean opened = false;
        int failures;
        synchronized (this) {
            lastFailureAt = clock.instant();
            if (!trial && state != CircuitState.CLOSED) {
                return;
            }
            failures = ++failureCount;
            if (state == CircuitState.HALF_OPEN || failureCount >= threshold) {
                opened = state != CircuitState.OPEN;
                state = CircuitState.OPEN;
                openedAt = lastFailureAt;
                trialInFlight = false;
            }
        }
        if (opened) {
            log.warn("Circuit breaker for {} opened after {} failures: {}", name, failures, error.getMessage());
            onOpen.run();
        }
    }

    private synchronized void releaseTrial() {
        trialInFlight = false;
    }

    private boolean resetTimeoutElapsed() {
        return openedAt != null && !clock.instant().isBefore(openedAt.plus(resetTimeout));
    }

    private enum Admission {
        ALLOWED,
        TRIAL,
        REJECTED
    }

    public record CircuitBreakerStats(CircuitState state, int failureCount, int threshold, Instant lastFailureAt) {
    }
}
