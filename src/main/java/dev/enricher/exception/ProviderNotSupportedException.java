package dev.enricher.exception;

public class ProviderNotSupportedException extends ProviderException {

    public ProviderNotSupportedException(String providerName, String operation) {
        super(providerName, operation + " is not supported by this provider: " + providerName);
    }
}
