package dev.enricher.exception;

public class JobNotFoundException extends EnricherException {

    public JobNotFoundException(long jobId) {
        super("Job not found: " + jobId);
    }

    protected JobNotFoundException(String message) {
        super(message);
    }
}
