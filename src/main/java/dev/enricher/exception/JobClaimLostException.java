package dev.enricher.exception;

/**
 * The job is still queued but no longer held by the caller's claim: it was requeued as stuck
 * and possibly claimed by another worker.
 */
public class JobClaimLostException extends JobNotFoundException {

    public JobClaimLostException(long jobId) {
        super("Job " + jobId + " is no longer held by this claim");
    }
}
