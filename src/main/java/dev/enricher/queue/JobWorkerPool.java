package dev.enricher.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.enricher.config.QueueConfig;
import dev.enricher.entity.Job;
import dev.enricher.exception.JobNotFoundException;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.JobType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers, each looping dequeue, handle, complete or fail.
 *
 * <p>A job's own failure never stops a worker. Storage failures escape the job and count
 * towards a pause: after {@code infrastructureFailureLimit} in a row the worker sleeps for
 * {@code infrastructurePauseMs} before polling again. While a job runs, its claim is kept
 * alive with a heartbeat every {@code heartbeatIntervalMs}.
 */
@Slf4j
@Component
public class JobWorkerPool {

    private final JobQueueService queue;
    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);
    private final QueueConfig config;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ExecutorService executor;
    private ScheduledExecutorService heartbeats;

    public JobWorkerPool(JobQueueService queue, List<JobHandler> handlers, QueueConfig config,
                         ObjectMapper objectMapper) {
        this.queue = queue;
        this.config = config;
        this.objectMapper = objectMapper;
        for (JobHandler handler : handlers) {
            if (this.handlers.put(handler.getType(), handler) != null) {
                throw new IllegalStateException("Duplicate handler for job type " + handler.getType().getCode());
            }
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Worker pool already running");
            return;
        }
        int workers = Math.max(1, config.getWorkers());
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "job-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            thread.setUncaughtExceptionHandler((t, e) -> log.error("{} terminated: {}", t.getName(), e.toString(), e));
            return thread;
        });
        heartbeats = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "job-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < workers; i++) {
            executor.execute(this::workerLoop);
        }
        log.info("Started {} queue workers (handlers: {})", workers, handlers.keySet());
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        heartbeats.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Queue workers did not stop within 30 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping queue workers");
        }
        log.info("Queue workers stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void workerLoop() {
        int consecutiveFailures = 0;
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                boolean processed = processNext();
                consecutiveFailures = 0;
                if (!processed) {
                    Thread.sleep(config.getPollIntervalMs());
                }
            } catch (DataAccessException e) {
                consecutiveFailures++;
                log.error("Queue storage failure ({} in a row): {}", consecutiveFailures, e.getMessage(), e);
                if (!pauseAfterFailure(consecutiveFailures)) {
                    return;
                }
                if (consecutiveFailures >= config.getInfrastructureFailureLimit()) {
                    consecutiveFailures = 0;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error in queue worker, continuing: {}", e.getMessage(), e);
                if (!pauseAfterFailure(1)) {
                    return;
                }
            }
        }
    }

    private boolean pauseAfterFailure(int consecutiveFailures) {
        long pauseMs = config.getPollIntervalMs();
        if (consecutiveFailures >= config.getInfrastructureFailureLimit()) {
            pauseMs = config.getInfrastructurePauseMs();
            log.error("Pausing worker for {}ms after {} consecutive storage failures", pauseMs, consecutiveFailures);
        }
        try {
            Thread.sleep(pauseMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Claim and run one job.
     *
     * @return false if nothing was claimable
     * @throws DataAccessException if the queue storage fails
     */
    public boolean processNext() {
        Optional<Job> claimed = queue.dequeue();
        if (claimed.isEmpty()) {
            return false;
        }
        Job job = claimed.get();
        ScheduledFuture<?> heartbeat = startHeartbeat(job);
        try {
            runJob(job);
        } catch (JobNotFoundException e) {
            log.warn("Dropping outcome of job {}: {}", job.getId(), e.getMessage());
        } finally {
            if (heartbeat != null) {
                heartbeat.cancel(false);
            }
        }
        return true;
    }

    private void runJob(Job job) {
        JobHandler handler = handlers.get(job.getType());
        if (handler == null) {
            queue.failPermanently(job, "No handler registered for job type " + job.getType().getCode());
            return;
        }

        log.debug("Running job {} ({}), attempt {}", job.getId(), job.getType().getCode(), job.getRetryCount() + 1);
        String result;
        try {
            JsonNode payload = objectMapper.readTree(job.getPayload());
            result = handler.handle(job, payload).block();
        } catch (DataAccessException e) {
            throw e;
        } catch (JsonProcessingException | ValidationException e) {
            queue.failPermanently(job, e.getMessage());
            return;
        } catch (RuntimeException e) {
            queue.fail(job, describe(e));
            return;
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            log.error("Handler for job {} raised {}", job.getId(), e.toString(), e);
            queue.fail(job, describe(e));
            return;
        }
        queue.complete(job, result);
    }

    private ScheduledFuture<?> startHeartbeat(Job job) {
        ScheduledExecutorService scheduler = heartbeats;
        if (scheduler == null || scheduler.isShutdown()) {
            return null;
        }
        long interval = Math.max(1, config.getHeartbeatIntervalMs());
        try {
            return scheduler.scheduleAtFixedRate(() -> beat(job), interval, interval, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Heartbeat scheduler stopped, running job {} without heartbeat", job.getId());
            return null;
        }
    }

    private void beat(Job job) {
        try {
            if (!queue.heartbeat(job)) {
                log.warn("Job {} is no longer held by this worker", job.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Heartbeat for job {} failed: {}", job.getId(), e.getMessage());
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
