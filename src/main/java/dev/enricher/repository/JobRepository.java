package dev.enricher.repository;

import dev.enricher.entity.Job;
import dev.enricher.model.JobStatus;
import dev.enricher.model.JobType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Active job queue. State transitions go through the conditional updates below.
 */
@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Claimable jobs in dequeue order: priority, then creation time.
     */
    @Query("SELECT j.id FROM Job j WHERE j.status = dev.enricher.model.JobStatus.PENDING " +
           "AND j.nextAttemptAt <= :now ORDER BY j.priority ASC, j.createdAt ASC, j.id ASC")
    List<Long> findClaimableIds(Instant now, Pageable page);

    /**
     * Claim a job. Returns 1 for the single caller that wins, 0 for everyone else.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = dev.enricher.model.JobStatus.PROCESSING, j.startedAt = :now, " +
           "j.updatedAt = :now, j.claimToken = :claimToken " +
           "WHERE j.id = :id AND j.status = dev.enricher.model.JobStatus.PENDING")
    int claim(Long id, String claimToken, Instant now);

    /**
     * The row if it is still processing under the given claim, locked for the caller's transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id AND j.status = dev.enricher.model.JobStatus.PROCESSING " +
           "AND j.claimToken = :claimToken")
    Optional<Job> lockClaimed(Long id, String claimToken);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.updatedAt = :now WHERE j.id = :id " +
           "AND j.status = dev.enricher.model.JobStatus.PROCESSING AND j.claimToken = :claimToken")
    int heartbeat(Long id, String claimToken, Instant now);

    /**
     * Move retrying jobs whose backoff has elapsed back to pending.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = dev.enricher.model.JobStatus.PENDING, j.updatedAt = :now " +
           "WHERE j.status = dev.enricher.model.JobStatus.RETRYING AND j.nextAttemptAt <= :now")
    int promoteDueRetries(Instant now);

    /**
     * Requeue jobs whose worker has not sent a heartbeat since the threshold.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Job j SET j.status = dev.enricher.model.JobStatus.PENDING, j.startedAt = null, " +
           "j.claimToken = null, j.nextAttemptAt = :now, j.updatedAt = :now " +
           "WHERE j.status = dev.enricher.model.JobStatus.PROCESSING AND j.updatedAt < :threshold")
    int resetStuckJobs(Instant threshold, Instant now);

    List<Job> findByStatusOrderByPriorityAscCreatedAtAsc(JobStatus status);

    List<Job> findByTypeOrderByPriorityAscCreatedAtAsc(JobType type);

    List<Job> findByStatusAndTypeOrderByPriorityAscCreatedAtAsc(JobStatus status, JobType type);

    List<Job> findAllByOrderByPriorityAscCreatedAtAsc();

    long countByStatus(JobStatus status);

    Optional<Job> findFirstByStatusOrderByCreatedAtAsc(JobStatus status);
}
