package dev.enricher.model;

/**
 * Origin of a provider request. Webhook and user traffic may use the rate limiter's burst capacity.
 */
public enum RequestPriority {
    WEBHOOK,
    USER,
    BACKGROUND;

    public boolean allowsBurst() {
        return this != BACKGROUND;
    }
}
