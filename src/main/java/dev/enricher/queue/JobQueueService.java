package dev.enricher.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.enricher.config.QueueConfig;
import dev.enricher.entity.Job;
import dev.enricher.entity.JobHistory;
import dev.enricher.exception.JobClaimLostException;
import dev.enricher.exception.JobNotFoundException;
import dev.enricher.exception.ValidationException;
import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.model.JobStatus;
import dev.enricher.model.JobType;
import dev.enricher.repository.JobHistoryRepository;
import dev.enricher.repository.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Durable priority queue. Lower priority values dequeue first, equal priorities in creation
 * order. Terminal jobs are copied to the history table and removed from the queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueueService {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final JobRepository jobRepository;
    private final JobHistoryRepository historyRepository;
    private final JobPayloadValidator validator;
    private final QueueConfig queueConfig;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final EnricherMetrics metrics;
    private final Clock clock;

    public long enqueue(JobType type, Map<String, ?> payload, int priority) {
        return enqueue(type, objectMapper.valueToTree(payload), priority, queueConfig.getMaxRetries());
    }

    public long enqueue(JobType type, JsonNode payload, int priority) {
        return enqueue(type, payload, priority, queueConfig.getMaxRetries());
    }

    /**
     * Validate and persist a new pending job.
     *
     * @throws ValidationException if the payload does not match the job type; no row is created
     */
    @Transactional
    public long enqueue(JobType type, JsonNode payload, int priority, int maxRetries) {
        validator.validate(type, payload, priority);
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries must not be negative: " + maxRetries);
        }

        Instant now = clock.instant();
        Job job = Job.builder()
                .type(type)
                .priority(priority)
                .payload(payload.toString())
                .status(JobStatus.PENDING)
                .retryCount(0)
                .maxRetries(maxRetries)
                .createdAt(now)
                .nextAttemptAt(now)
                .updatedAt(now)
                .build();

        Job saved = jobRepository.save(job);
        metrics.recordJobEnqueued(type.getCode());
        log.debug("Enqueued job {} ({}, priority {})", saved.getId(), type.getCode(), priority);
        return saved.getId();
    }

    /**
     * Claim the next job. Each candidate is claimed with one conditional update, so of several
     * concurrent callers exactly one gets a given job. The returned job carries the claim token
     * that {@link #complete}, {@link #fail} and {@link #heartbeat} check.
     */
    public Optional<Job> dequeue() {
        Instant now = clock.instant();
        transactionTemplate.executeWithoutResult(status -> jobRepository.promoteDueRetries(now));

        Set<Long> attempted = new HashSet<>();
        while (true) {
            List<Long> candidates = jobRepository.findClaimableIds(now, PageRequest.of(0, attempted.size() + 1));
            Optional<Long> next = candidates.stream().filter(id -> !attempted.contains(id)).findFirst();
            if (next.isEmpty()) {
                return Optional.empty();
            }

            Long id = next.get();
            attempted.add(id);
            if (tryClaim(id, now)) {
                log.debug("Claimed job {}", id);
                return jobRepository.findById(id);
            }
        }
    }

    private boolean tryClaim(Long id, Instant now) {
        String claimToken = UUID.randomUUID().toString();
        try {
            Integer updated = transactionTemplate.execute(status -> jobRepository.claim(id, claimToken, now));
            return updated != null && updated == 1;
        } catch (ConcurrencyFailureException e) {
            log.debug("Lost claim on job {}: {}", id, e.getMessage());
            return false;
        }
    }

    /**
     * Keep a claimed job out of the stuck-job sweep.
     *
     * @return false if the claim is gone
     */
    @Transactional
    public boolean heartbeat(Job claimed) {
        return jobRepository.heartbeat(claimed.getId(), claimed.getClaimToken(), clock.instant()) == 1;
    }

    /**
     * @throws JobNotFoundException if the job is no longer processing under this claim
     */
    @Transactional
    public void complete(Job claimed, String result) {
        Job job = lockClaimed(claimed);
        Instant now = clock.instant();
        long durationMs = durationSinceStart(job, now);

        job.setStatus(JobStatus.COMPLETED);
        job.setCompletedAt(now);
        job.setDurationMs(durationMs);
        archive(job, result);

        metrics.recordJobOutcome(job.getType().getCode(), "completed");
        metrics.recordJobDuration(job.getType().getCode(), durationMs);
        log.info("Job {} ({}) completed in {}ms", job.getId(), job.getType().getCode(), durationMs);
    }

    /**
     * Record a failed attempt. The job is rescheduled with exponential backoff while it has
     * retries left, otherwise archived as failed.
     *
     * @return the job's new status, {@link JobStatus#RETRYING} or {@link JobStatus#FAILED}
     * @throws JobNotFoundException if the job is no longer processing under this claim
     */
    @Transactional
    public JobStatus fail(Job claimed, String error) {
        Job job = lockClaimed(claimed);
        if (job.getRetryCount() >= job.getMaxRetries()) {
            return archiveFailed(job, error);
        }

        Instant now = clock.instant();
        long backoffMs = backoffMs(job.getRetryCount());
        job.setRetryCount(job.getRetryCount() + 1);
        job.setStatus(JobStatus.RETRYING);
        job.setClaimToken(null);
        job.setError(truncate(error));
        job.setNextAttemptAt(now.plusMillis(backoffMs));
        job.setUpdatedAt(now);
        jobRepository.save(job);

        metrics.recordJobOutcome(job.getType().getCode(), "retrying");
        log.warn("Job {} ({}) failed, retry {}/{} in {}ms: {}", job.getId(), job.getType().getCode(),
                job.getRetryCount(), job.getMaxRetries(), backoffMs, error);
        return JobStatus.RETRYING;
    }

    /**
     * Archive a job as failed regardless of remaining retries.
     *
     * @throws JobNotFoundException if the job is no longer processing under this claim
     */
    @Transactional
    public JobStatus failPermanently(Job claimed, String error) {
        return archiveFailed(lockClaimed(claimed), error);
    }

    private Job lockClaimed(Job claimed) {
        long jobId = claimed.getId();
        return jobRepository.lockClaimed(jobId, claimed.getClaimToken()).orElseThrow(() ->
                jobRepository.existsById(jobId) ? new JobClaimLostException(jobId) : new JobNotFoundException(jobId));
    }

    private JobStatus archiveFailed(Job job, String error) {
        Instant now = clock.instant();
        job.setStatus(JobStatus.FAILED);
        job.setError(truncate(error));
        job.setCompletedAt(now);
        job.setDurationMs(durationSinceStart(job, now));
        archive(job, null);

        metrics.recordJobOutcome(job.getType().getCode(), "failed");
        log.error("Job {} ({}) failed permanently after {} retries: {}", job.getId(), job.getType().getCode(),
                job.getRetryCount(), error);
        return JobStatus.FAILED;
    }

    /**
     * Requeue processing jobs whose worker has stopped sending heartbeats.
     */
    @Transactional
    public int recoverStuckJobs() {
        Instant now = clock.instant();
        Instant threshold = now.minus(Duration.ofMinutes(queueConfig.getStuckJobThresholdMinutes()));
        int reset = jobRepository.resetStuckJobs(threshold, now);
        if (reset > 0) {
            log.warn("Requeued {} jobs stuck in processing since before {}", reset, threshold);
        }
        return reset;
    }

    public Optional<Job> getJob(long jobId) {
        return jobRepository.findById(jobId);
    }

    public List<Job> listJobs(JobStatus status, JobType type) {
        if (status != null && type != null) {
            return jobRepository.findByStatusAndTypeOrderByPriorityAscCreatedAtAsc(status, type);
        }
        if (status != null) {
            return jobRepository.findByStatusOrderByPriorityAscCreatedAtAsc(status);
        }
        if (type != null) {
            return jobRepository.findByTypeOrderByPriorityAscCreatedAtAsc(type);
        }
        return jobRepository.findAllByOrderByPriorityAscCreatedAtAsc();
    }

    public List<JobHistory> getHistory(JobStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        if (status == null) {
            return historyRepository.findAllByOrderByCompletedAtDesc(page);
        }
        return historyRepository.findByStatusOrderByCompletedAtDesc(status, page);
    }

    public List<JobHistory> getHistoryForJob(long jobId) {
        return historyRepository.findByJobId(jobId);
    }

    public QueueStats getStats() {
        long pending = jobRepository.countByStatus(JobStatus.PENDING);
        long processing = jobRepository.countByStatus(JobStatus.PROCESSING);
        long retrying = jobRepository.countByStatus(JobStatus.RETRYING);
        long oldestAge = jobRepository.findFirstByStatusOrderByCreatedAtAsc(JobStatus.PENDING)
                .map(job -> Math.max(0, Duration.between(job.getCreatedAt(), clock.instant()).toMillis()))
                .orElse(0L);

        metrics.updateQueueDepth((int) pending, (int) processing, (int) retrying);
        return new QueueStats(pending, processing, retrying,
                historyRepository.countByStatus(JobStatus.COMPLETED),
                historyRepository.countByStatus(JobStatus.FAILED),
                oldestAge);
    }

    /**
     * Delete history older than the retention windows.
     *
     * @return number of history rows deleted
     */
    @Transactional
    public int cleanupHistory(int completedRetentionDays, int failedRetentionDays) {
        Instant now = clock.instant();
        int completed = historyRepository.deleteOlderThan(JobStatus.COMPLETED,
                now.minus(Duration.ofDays(completedRetentionDays)));
        int failed = historyRepository.deleteOlderThan(JobStatus.FAILED,
                now.minus(Duration.ofDays(failedRetentionDays)));
        if (completed + failed > 0) {
            log.info("Removed {} completed and {} failed jobs from history", completed, failed);
        }
        return completed + failed;
    }

    long backoffMs(int retryCount) {
        long base = queueConfig.getBackoffBaseMs();
        long delay = base * (1L << Math.min(retryCount, 30));
        return Math.min(delay, queueConfig.getBackoffMaxMs());
    }

    private void archive(Job job, String result) {
        historyRepository.save(JobHistory.builder()
                .jobId(job.getId())
                .type(job.getType())
                .priority(job.getPriority())
                .payload(job.getPayload())
                .status(job.getStatus())
                .error(job.getError())
                .result(truncate(result))
                .retryCount(job.getRetryCount())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .durationMs(job.getDurationMs())
                .build());
        jobRepository.delete(job);
    }

    private static long durationSinceStart(Job job, Instant now) {
        if (job.getStartedAt() == null) {
            return 0L;
        }
        return Math.max(0, Duration.between(job.getStartedAt(), now).toMillis());
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_LENGTH);
    }
}
