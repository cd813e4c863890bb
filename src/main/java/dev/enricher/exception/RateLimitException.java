package dev.enricher.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Provider answered 429. {@code retryAfter} is null when the provider did not signal a cooldown.
 */
@Getter
public class RateLimitException extends ProviderException {

    private final Duration retryAfter;

    public RateLimitException(String providerName, Duration retryAfter) {
        super(providerName, 429, "Rate limit exceeded for provider: " + providerName, null);
        this.retryAfter = retryAfter;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
