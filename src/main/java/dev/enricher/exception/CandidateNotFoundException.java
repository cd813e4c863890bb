package dev.enricher.exception;

public class CandidateNotFoundException extends EnricherException {

    public CandidateNotFoundException(long candidateId) {
        super("Asset candidate not found: " + candidateId);
    }
}
