package dev.enricher.exception;

/**
 * Base class for all errors raised by the enrichment pipeline.
 */
public class EnricherException extends RuntimeException {

    public EnricherException(String message) {
        super(message);
    }

    public EnricherException(String message, Throwable cause) {
        super(message, cause);
    }
}
