package dev.enricher.exception;

/**
 * Call short-circuited because the provider's breaker is open.
 */
public class CircuitOpenException extends ProviderException {

    public CircuitOpenException(String providerName) {
        super(providerName, "Circuit breaker is open for provider: " + providerName);
    }
}
