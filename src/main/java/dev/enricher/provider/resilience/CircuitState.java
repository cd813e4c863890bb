package dev.enricher.provider.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
