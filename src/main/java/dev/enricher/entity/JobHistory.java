package dev.enricher.entity;

import dev.enricher.model.JobStatus;
import dev.enricher.model.JobType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Append-only record of a job that reached a terminal state.
 */
@Getter
@ToString
@Entity
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Table(name = "job_history", indexes = {
        @Index(name = "idx_job_history_job", columnList = "jobId"),
        @Index(name = "idx_job_history_completed", columnList = "status, completedAt")
})
public class JobHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 64)
    private JobType type;

    @Column(nullable = false, updatable = false)
    private int priority;

    @Lob
    @Column(nullable = false, updatable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private JobStatus status;

    @Column(length = 4000, updatable = false)
    private String error;

    @Column(length = 4000, updatable = false)
    private String result;

    @Column(nullable = false, updatable = false)
    private int retryCount;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @Column(updatable = false)
    private Instant startedAt;

    @Column(nullable = false, updatable = false)
    private Instant completedAt;

    @Column(updatable = false)
    private Long durationMs;
}
