package dev.enricher.repository;

import dev.enricher.entity.ProviderRefreshLog;
import dev.enricher.model.EntityType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProviderRefreshLogRepository extends JpaRepository<ProviderRefreshLog, Long> {

    Optional<ProviderRefreshLog> findByEntityTypeAndEntityIdAndProvider(EntityType entityType, long entityId,
                                                                        String provider);

    List<ProviderRefreshLog> findByEntityTypeAndEntityId(EntityType entityType, long entityId);

    List<ProviderRefreshLog> findByNeedsRefreshTrue();

    /**
     * Flag rows not checked since the cutoff.
     */
    @Modifying
    @Query("UPDATE ProviderRefreshLog r SET r.needsRefresh = true " +
           "WHERE r.needsRefresh = false AND r.lastChecked < :cutoff")
    int markStale(Instant cutoff);
}
