package dev.enricher.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.enricher.config.QueueConfig;
import dev.enricher.entity.Job;
import dev.enricher.exception.EnricherException;
import dev.enricher.exception.JobClaimLostException;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.JobStatus;
import dev.enricher.model.JobType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobWorkerPoolTest {

    @Mock
    private JobQueueService queue;

    @Mock
    private JobHandler handler;

    private QueueConfig config;

    private JobWorkerPool pool;

    @BeforeEach
    void setUp() {
        when(handler.getType()).thenReturn(JobType.ENRICH_METADATA);
        config = new QueueConfig();
        config.setPollIntervalMs(10);
        pool = new JobWorkerPool(queue, List.of(handler), config, new ObjectMapper());
    }

    private Job job(JobType type, String payload) {
        return job(7L, type, payload);
    }

    private Job job(long id, JobType type, String payload) {
        return Job.builder()
                .id(id)
                .claimToken("claim-" + id)
                .type(type)
                .priority(5)
                .payload(payload)
                .status(JobStatus.PROCESSING)
                .build();
    }

    @Test
    @DisplayName("Should report an empty queue")
    void shouldReturnFalseWhenQueueEmpty() {
        when(queue.dequeue()).thenReturn(Optional.empty());

        assertThat(pool.processNext()).isFalse();
    }

    @Test
    @DisplayName("Should complete a job whose handler succeeds")
    void shouldCompleteSuccessfulJob() {
        Job job = job(JobType.ENRICH_METADATA, "{\"entityType\":\"movie\",\"entityId\":1}");
        when(queue.dequeue()).thenReturn(Optional.of(job));
        when(handler.handle(eq(job), any(JsonNode.class))).thenReturn(Mono.just("enriched"));

        assertThat(pool.processNext()).isTrue();

        verify(queue).complete(job, "enriched");
    }

    @Test
    @DisplayName("Should record a retryable failure when the handler errors")
    void shouldFailJobOnHandlerError() {
        Job job = job(JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(job));
        when(handler.handle(eq(job), any(JsonNode.class)))
                .thenReturn(Mono.error(new EnricherException("All providers failed")));

        pool.processNext();

        verify(queue).fail(job, "All providers failed");
        verify(queue, never()).complete(any(Job.class), any());
    }

    @Test
    @DisplayName("Should fail permanently on validation errors")
    void shouldFailPermanentlyOnValidationError() {
        Job job = job(JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(job));
        when(handler.handle(eq(job), any(JsonNode.class)))
                .thenReturn(Mono.error(new ValidationException("movie 1 does not exist")));

        pool.processNext();

        verify(queue).failPermanently(job, "movie 1 does not exist");
        verify(queue, never()).fail(any(Job.class), anyString());
    }

    @Test
    @DisplayName("Should fail permanently when the stored payload is not JSON")
    void shouldFailPermanentlyOnUnreadablePayload() {
        Job job = job(JobType.ENRICH_METADATA, "{not json");
        when(queue.dequeue()).thenReturn(Optional.of(job));

        pool.processNext();

        verify(queue).failPermanently(eq(job), anyString());
    }

    @Test
    @DisplayName("Should fail permanently when no handler exists for the type")
    void shouldFailJobWithoutHandler() {
        Job job = job(JobType.SCHEDULED_CLEANUP, "{\"manual\":true}");
        when(queue.dequeue()).thenReturn(Optional.of(job));

        pool.processNext();

        verify(queue).failPermanently(eq(job), anyString());
    }

    @Test
    @DisplayName("Should let storage failures escape the job")
    void shouldPropagateStorageFailure() {
        when(queue.dequeue()).thenThrow(new DataAccessResourceFailureException("database is locked"));

        assertThatThrownBy(() -> pool.processNext()).isInstanceOf(DataAccessResourceFailureException.class);
    }

    @Test
    @DisplayName("Should reject two handlers for the same type")
    void shouldRejectDuplicateHandlers() {
        assertThatThrownBy(() -> new JobWorkerPool(queue, List.of(handler, handler), new QueueConfig(), new ObjectMapper()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should process jobs in the background until stopped")
    void shouldRunWorkersUntilStopped() {
        Job job = job(JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(job), Optional.empty());
        when(handler.handle(eq(job), any(JsonNode.class))).thenReturn(Mono.just("done"));

        pool.start();
        try {
            verify(queue, timeout(2000)).complete(job, "done");
            assertThat(pool.isRunning()).isTrue();
        } finally {
            pool.stop();
        }
        assertThat(pool.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should drop the outcome of a job whose claim was taken over")
    void shouldDropOutcomeWhenClaimLost() {
        Job job = job(JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(job));
        when(handler.handle(eq(job), any(JsonNode.class))).thenReturn(Mono.just("enriched"));
        doThrow(new JobClaimLostException(7L)).when(queue).complete(job, "enriched");

        assertThat(pool.processNext()).isTrue();
    }

    @Test
    @DisplayName("Should record a failed attempt when the handler raises an error")
    void shouldFailJobWhenHandlerThrowsError() {
        Job job = job(JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(job));
        when(handler.handle(eq(job), any(JsonNode.class))).thenThrow(new AssertionError("broken invariant"));

        assertThat(pool.processNext()).isTrue();

        verify(queue).fail(job, "broken invariant");
        verify(queue, never()).complete(any(Job.class), any());
    }

    @Test
    @DisplayName("Should keep the worker alive when recording an outcome throws")
    void shouldKeepWorkingAfterUnexpectedQueueError() {
        config.setWorkers(1);
        Job first = job(1L, JobType.ENRICH_METADATA, "{}");
        Job second = job(2L, JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(first), Optional.of(second), Optional.empty());
        when(handler.handle(any(Job.class), any(JsonNode.class))).thenReturn(Mono.just("done"));
        doThrow(new IllegalStateException("connection pool closed")).when(queue).complete(first, "done");

        pool.start();
        try {
            verify(queue, timeout(2000)).complete(second, "done");
        } finally {
            pool.stop();
        }
    }

    @Test
    @DisplayName("Should send heartbeats while a job is running")
    void shouldHeartbeatLongRunningJob() {
        config.setWorkers(1);
        config.setHeartbeatIntervalMs(10);
        Job job = job(JobType.ENRICH_METADATA, "{}");
        when(queue.dequeue()).thenReturn(Optional.of(job), Optional.empty());
        when(queue.heartbeat(job)).thenReturn(true);
        when(handler.handle(eq(job), any(JsonNode.class)))
                .thenReturn(Mono.just("done").delayElement(Duration.ofMillis(300)));

        pool.start();
        try {
            verify(queue, timeout(2000).atLeast(2)).heartbeat(job);
            verify(queue, timeout(2000)).complete(job, "done");
        } finally {
            pool.stop();
        }
    }
}
