package dev.enricher.repository;

import dev.enricher.entity.AssetCandidate;
import dev.enricher.model.EntityType;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AssetCandidateRepository extends JpaRepository<AssetCandidate, Long> {

    List<AssetCandidate> findByEntityTypeAndEntityIdAndAssetTypeOrderByScoreDesc(EntityType entityType,
                                                                                 long entityId, String assetType);

    List<AssetCandidate> findByEntityTypeAndEntityIdAndAssetTypeAndBlockedFalseOrderByScoreDesc(
            EntityType entityType, long entityId, String assetType);

    Optional<AssetCandidate> findByEntityTypeAndEntityIdAndAssetTypeAndSelectedTrue(EntityType entityType,
                                                                                  long entityId, String assetType);

    Optional<AssetCandidate> findByEntityTypeAndEntityIdAndAssetTypeAndUrl(EntityType entityType, long entityId,
                                                                          String assetType, String url);

    /**
     * All rows of one (entity, asset type) group, locked for a selection change.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM AssetCandidate c WHERE c.entityType = :entityType AND c.entityId = :entityId " +
           "AND c.assetType = :assetType")
    List<AssetCandidate> lockGroup(EntityType entityType, long entityId, String assetType);

    long countByCacheAssetId(Long cacheAssetId);
}
