package dev.enricher.service;

import dev.enricher.config.ScoringConfig;
import dev.enricher.entity.AssetCandidate;
import dev.enricher.exception.CandidateNotFoundException;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.AnalyzedAsset;
import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.EntityType;
import dev.enricher.model.ScoredAsset;
import dev.enricher.repository.AssetCandidateRepository;
import dev.enricher.util.PerceptualHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scored candidates per (entity, asset type) and which of them is selected.
 *
 * <p>At most one non-blocked candidate per group is selected. Every selection change locks the
 * group's rows and clears the old selection before setting the new one in the same transaction.
 * Blocked candidates are never deleted. Near-duplicate images are all stored; they are collapsed
 * onto their best copy only when ranking, so blocking one copy leaves the others selectable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetCandidateStore {

    public static final String SELECTED_BY_AUTO = "auto";
    public static final String SELECTED_BY_USER = "user";

    static final Comparator<AssetCandidate> SELECTION_ORDER = Comparator
            .comparingDouble(AssetCandidate::getScore).reversed()
            .thenComparing(AssetCandidate::area, Comparator.reverseOrder())
            .thenComparing(AssetCandidate::getProvider)
            .thenComparing(AssetCandidate::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AssetCandidateRepository repository;
    private final ContentAddressedStore contentStore;
    private final ScoringConfig scoringConfig;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Upsert a candidate row per scored asset, keyed by URL, taking over the cache reference each
     * asset holds. Existing selection and block flags are preserved; the group is then
     * auto-selected. If the rows cannot be saved, the references are released.
     */
    public List<AssetCandidate> saveCandidates(EnrichmentTarget target, String assetType, List<ScoredAsset> scored) {
        List<Long> surplusCacheIds = new ArrayList<>();
        List<AssetCandidate> saved;
        try {
            saved = transactionTemplate.execute(status -> {
                Instant now = clock.instant();
                List<AssetCandidate> rows = new ArrayList<>();
                for (ScoredAsset item : scored) {
                    rows.add(upsert(target, assetType, item, now, surplusCacheIds));
                }
                selectBest(target.entityType(), target.entityId(), assetType);
                return rows;
            });
        } catch (RuntimeException e) {
            log.warn("Could not save {} candidates for {} {}, releasing their cached content: {}", assetType,
                    target.entityType(), target.entityId(), e.getMessage());
            scored.forEach(item -> releaseQuietly(item.asset().cacheAssetId()));
            throw e;
        }
        surplusCacheIds.forEach(this::releaseQuietly);

        log.debug("Saved {} {} candidates for {} {}", scored.size(), assetType, target.entityType(), target.entityId());
        return saved == null ? List.of() : saved;
    }

    private AssetCandidate upsert(EnrichmentTarget target, String assetType, ScoredAsset scored,
                                  Instant now, List<Long> surplusCacheIds) {
        AnalyzedAsset asset = scored.asset();
        AssetCandidate row = repository.findByEntityTypeAndEntityIdAndAssetTypeAndUrl(
                        target.entityType(), target.entityId(), assetType, asset.source().url())
                .orElseGet(() -> AssetCandidate.builder()
                        .entityType(target.entityType())
                        .entityId(target.entityId())
                        .assetType(assetType)
                        .url(asset.source().url())
                        .build());

        if (row.getCacheAssetId() != null) {
            // Replaced by the reference the asset brings, even when both name the same entry.
            surplusCacheIds.add(row.getCacheAssetId());
        }
        row.setProvider(asset.source().providerName());
        row.setWidth(asset.width());
        row.setHeight(asset.height());
        row.setLanguage(asset.source().language());
        row.setVoteAverage(asset.source().voteAverage());
        row.setVoteCount(asset.source().voteCount());
        row.setDurationSeconds(asset.durationSeconds());
        row.setScore(scored.score());
        row.setCacheAssetId(asset.cacheAssetId());
        row.setContentHash(asset.contentHash());
        row.setPerceptualHash(asset.perceptualHash());
        row.setLastRefreshed(now);
        return repository.save(row);
    }

    public List<AssetCandidate> listCandidates(EntityType entityType, long entityId, String assetType,
                                               boolean includeBlocked) {
        if (includeBlocked) {
            return repository.findByEntityTypeAndEntityIdAndAssetTypeOrderByScoreDesc(entityType, entityId, assetType);
        }
        return repository.findByEntityTypeAndEntityIdAndAssetTypeAndBlockedFalseOrderByScoreDesc(
                entityType, entityId, assetType);
    }

    /**
     * Non-blocked candidates in selection order, with near-duplicate images collapsed onto the
     * best-ranked copy.
     */
    @Transactional(readOnly = true)
    public List<AssetCandidate> rankCandidates(EntityType entityType, long entityId, String assetType) {
        return rank(repository.findByEntityTypeAndEntityIdAndAssetTypeAndBlockedFalseOrderByScoreDesc(
                entityType, entityId, assetType));
    }

    public Optional<AssetCandidate> getSelected(EntityType entityType, long entityId, String assetType) {
        return repository.findByEntityTypeAndEntityIdAndAssetTypeAndSelectedTrue(entityType, entityId, assetType);
    }

    /**
     * Manually select a candidate. A user selection survives later automatic reselection.
     */
    @Transactional
    public AssetCandidate select(long candidateId, String selectedBy) {
        AssetCandidate candidate = find(candidateId);
        if (candidate.isBlocked()) {
            throw new ValidationException("Candidate " + candidateId + " is blocked and cannot be selected");
        }
        List<AssetCandidate> group = repository.lockGroup(candidate.getEntityType(), candidate.getEntityId(),
                candidate.getAssetType());
        AssetCandidate target = group.stream()
                .filter(c -> c.getId().equals(candidateId))
                .findFirst()
                .orElseThrow(() -> new CandidateNotFoundException(candidateId));
        setSelection(group, target, selectedBy);
        log.info("Candidate {} selected by {}", candidateId, selectedBy);
        return target;
    }

    /**
     * Select the best non-blocked candidate unless a user selection is in place.
     */
    @Transactional
    public Optional<AssetCandidate> autoSelect(EntityType entityType, long entityId, String assetType) {
        return selectBest(entityType, entityId, assetType);
    }

    /**
     * Block a candidate. If it was selected, the best remaining candidate is selected instead.
     */
    @Transactional
    public Optional<AssetCandidate> block(long candidateId, String blockedBy) {
        AssetCandidate candidate = find(candidateId);
        List<AssetCandidate> group = repository.lockGroup(candidate.getEntityType(), candidate.getEntityId(),
                candidate.getAssetType());
        AssetCandidate blocked = group.stream()
                .filter(c -> c.getId().equals(candidateId))
                .findFirst()
                .orElseThrow(() -> new CandidateNotFoundException(candidateId));

        boolean wasSelected = blocked.isSelected();
        blocked.setBlocked(true);
        blocked.setBlockedBy(blockedBy);
        blocked.setBlockedAt(clock.instant());
        blocked.setSelected(false);
        blocked.setSelectedBy(null);
        blocked.setSelectedAt(null);
        log.info("Candidate {} blocked by {}", candidateId, blockedBy);

        if (wasSelected) {
            return chooseAndSet(group);
        }
        return group.stream().filter(AssetCandidate::isSelected).findFirst();
    }

    @Transactional
    public AssetCandidate unblock(long candidateId) {
        AssetCandidate candidate = find(candidateId);
        List<AssetCandidate> group = repository.lockGroup(candidate.getEntityType(), candidate.getEntityId(),
                candidate.getAssetType());
        AssetCandidate unblocked = group.stream()
                .filter(c -> c.getId().equals(candidateId))
                .findFirst()
                .orElseThrow(() -> new CandidateNotFoundException(candidateId));
        unblocked.setBlocked(false);
        unblocked.setBlockedBy(null);
        unblocked.setBlockedAt(null);
        if (group.stream().noneMatch(AssetCandidate::isSelected)) {
            chooseAndSet(group);
        }
        return unblocked;
    }

    /**
     * Discard any user selection and select automatically.
     */
    @Transactional
    public Optional<AssetCandidate> resetSelection(EntityType entityType, long entityId, String assetType) {
        List<AssetCandidate> group = repository.lockGroup(entityType, entityId, assetType);
        return chooseAndSet(group);
    }

    private Optional<AssetCandidate> selectBest(EntityType entityType, long entityId, String assetType) {
        List<AssetCandidate> group = repository.lockGroup(entityType, entityId, assetType);
        Optional<AssetCandidate> userChoice = group.stream()
                .filter(c -> c.isSelected() && !c.isBlocked() && SELECTED_BY_USER.equals(c.getSelectedBy()))
                .findFirst();
        if (userChoice.isPresent()) {
            return userChoice;
        }
        return chooseAndSet(group);
    }

    private Optional<AssetCandidate> chooseAndSet(List<AssetCandidate> group) {
        Optional<AssetCandidate> best = rank(group).stream().findFirst();
        if (best.isEmpty()) {
            clearSelection(group);
            return Optional.empty();
        }
        setSelection(group, best.get(), SELECTED_BY_AUTO);
        return best;
    }

    private List<AssetCandidate> rank(List<AssetCandidate> group) {
        List<AssetCandidate> ordered = group.stream()
                .filter(c -> !c.isBlocked())
                .sorted(SELECTION_ORDER)
                .toList();
        List<AssetCandidate> kept = new ArrayList<>();
        for (AssetCandidate candidate : ordered) {
            if (kept.stream().noneMatch(existing -> isNearDuplicate(existing, candidate))) {
                kept.add(candidate);
            }
        }
        return kept;
    }

    private boolean isNearDuplicate(AssetCandidate a, AssetCandidate b) {
        if (a.getPerceptualHash() == null || b.getPerceptualHash() == null) {
            return false;
        }
        return PerceptualHash.distance(a.getPerceptualHash(), b.getPerceptualHash())
                <= scoringConfig.getDuplicateMaxDistance();
    }

    private void releaseQuietly(long cacheAssetId) {
        try {
            contentStore.release(cacheAssetId);
        } catch (RuntimeException e) {
            log.warn("Could not release cached content {}: {}", cacheAssetId, e.getMessage());
        }
    }

    private void setSelection(List<AssetCandidate> group, AssetCandidate chosen, String selectedBy) {
        if (chosen.isSelected() && Objects.equals(chosen.getSelectedBy(), selectedBy)) {
            clearSelection(group.stream().filter(c -> c != chosen).toList());
            return;
        }
        clearSelection(group);
        chosen.setSelected(true);
        chosen.setSelectedBy(selectedBy);
        chosen.setSelectedAt(clock.instant());
    }

    private static void clearSelection(List<AssetCandidate> group) {
        for (AssetCandidate candidate : group) {
            if (candidate.isSelected()) {
                candidate.setSelected(false);
                candidate.setSelectedBy(null);
                candidate.setSelectedAt(null);
            }
        }
    }

    private AssetCandidate find(long candidateId) {
        return repository.findById(candidateId).orElseThrow(() -> new CandidateNotFoundException(candidateId));
    }
}
