package dev.enricher.exception;

/**
 * Network failure, timeout or 5xx response.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String providerName, String message) {
        super(providerName, null, message, null);
    }

    public TransientProviderException(String providerName, Integer statusCode, String message, Throwable cause) {
        super(providerName, statusCode, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
