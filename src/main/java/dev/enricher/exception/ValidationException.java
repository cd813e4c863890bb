package dev.enricher.exception;

/**
 * Bad input. Never retried.
 */
public class ValidationException extends EnricherException {

    public ValidationException(String message) {
        super(message);
    }
}
