package dev.enricher.service;

import dev.enricher.entity.ProviderRefreshLog;
import dev.enricher.model.EntityType;
import dev.enricher.repository.ProviderRefreshLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * When each (entity, provider) pair was last checked, and whether it is due for a refresh.
 */
@Service
@RequiredArgsConstructor
public class RefreshLogService {

    private final ProviderRefreshLogRepository repository;
    private final Clock clock;

    @Transactional
    public ProviderRefreshLog recordCheck(EntityType entityType, long entityId, String provider, boolean needsRefresh) {
        Instant now = clock.instant();
        ProviderRefreshLog entry = repository.findByEntityTypeAndEntityIdAndProvider(entityType, entityId, provider)
                .orElseGet(() -> ProviderRefreshLog.builder()
                        .entityType(entityType)
                        .entityId(entityId)
                        .provider(provider)
                        .build());
        entry.setLastChecked(now);
        entry.setNeedsRefresh(needsRefresh);
        return repository.save(entry);
    }

    /**
     * Flag every pair not checked since the cutoff.
     */
    @Transactional
    public int markStale(Instant cutoff) {
        return repository.markStale(cutoff);
    }

    public List<ProviderRefreshLog> findNeedingRefresh() {
        return repository.findByNeedsRefreshTrue();
    }

    public List<ProviderRefreshLog> findForEntity(EntityType entityType, long entityId) {
        return repository.findByEntityTypeAndEntityId(entityType, entityId);
    }
}
