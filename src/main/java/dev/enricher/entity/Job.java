package dev.enricher.entity;

import dev.enricher.model.JobStatus;
import dev.enricher.model.JobType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Row of the active job queue. Only {@code JobQueueService} mutates it; terminal jobs are moved
 * to {@link JobHistory} and deleted from this table.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_queue", indexes = {
        @Index(name = "idx_job_queue_claim", columnList = "status, priority, createdAt"),
        @Index(name = "idx_job_queue_next_attempt", columnList = "nextAttemptAt")
})
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 64)
    private JobType type;

    @Column(nullable = false)
    private int priority;

    @Lob
    @Column(nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private JobStatus status;

    @Column(nullable = false)
    private int retryCount;

    @Column(nullable = false)
    private int maxRetries;

    @Column(length = 4000)
    private String error;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant startedAt;

    /**
     * Set on every claim. Completion and failure must present it, so a worker whose job was
     * requeued cannot finish the new owner's attempt.
     */
    @Column(length = 36)
    private String claimToken;

    @Column(nullable = false)
    private Instant nextAttemptAt;

    private Instant completedAt;

    private Long durationMs;

    /**
     * Last state change or worker heartbeat. The stuck-job sweep requeues processing rows whose
     * heartbeat is older than the threshold.
     */
    private Instant updatedAt;
}
