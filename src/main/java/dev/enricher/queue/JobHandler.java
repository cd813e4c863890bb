package dev.enricher.queue;

import com.fasterxml.jackson.databind.JsonNode;
import dev.enricher.entity.Job;
import dev.enricher.model.JobType;
import reactor.core.publisher.Mono;

/**
 * Executes one type of job. An error signal fails the job; a
 * {@link dev.enricher.exception.ValidationException} fails it without retry.
 */
public interface JobHandler {

    JobType getType();

    /**
     * @return a short result summary stored with the job history
     */
    Mono<String> handle(Job job, JsonNode payload);
}
