package dev.enricher.exception;

import lombok.Getter;

/**
 * Base class for errors coming out of a metadata provider call.
 */
@Getter
public class ProviderException extends EnricherException {

    private final String providerName;
    private final Integer statusCode;

    public ProviderException(String providerName, String message) {
        this(providerName, null, message, null);
    }

    public ProviderException(String providerName, Integer statusCode, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.statusCode = statusCode;
    }

    /**
     * Whether the call may succeed if attempted again later.
     */
    public boolean isRetryable() {
        return false;
    }
}
