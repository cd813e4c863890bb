package dev.enricher.exception;

/**
 * Provider rejected the credentials (401/403).
 */
public class AuthException extends ProviderException {

    public AuthException(String providerName) {
        super(providerName, 401, "Authentication failed for provider: " + providerName, null);
    }
}
