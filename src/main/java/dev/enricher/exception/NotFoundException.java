package dev.enricher.exception;

/**
 * Provider has no such resource. Treated as "no result", not as a provider failure.
 */
public class NotFoundException extends ProviderException {

    public NotFoundException(String providerName, String resourceId) {
        super(providerName, 404, "Resource not found at provider " + providerName + ": " + resourceId, null);
    }
}
