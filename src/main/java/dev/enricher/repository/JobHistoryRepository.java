package dev.enricher.repository;

import dev.enricher.entity.JobHistory;
import dev.enricher.model.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface JobHistoryRepository extends JpaRepository<JobHistory, Long> {

    List<JobHistory> findByJobId(Long jobId);

    List<JobHistory> findAllByOrderByCompletedAtDesc(Pageable page);

    List<JobHistory> findByStatusOrderByCompletedAtDesc(JobStatus status, Pageable page);

    long countByStatus(JobStatus status);

    /**
     * Delete terminal records of one status older than the cutoff (retention cleanup).
     */
    @Modifying
    @Query("DELETE FROM JobHistory h WHERE h.status = :status AND h.completedAt < :cutoff")
    int deleteOlderThan(JobStatus status, Instant cutoff);
}
