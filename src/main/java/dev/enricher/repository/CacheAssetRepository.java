package dev.enricher.repository;

import dev.enricher.entity.CacheAsset;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface CacheAssetRepository extends JpaRepository<CacheAsset, Long> {

    Optional<CacheAsset> findByContentHash(String contentHash);

    /**
     * Atomically add a reference to an existing entry. Returns 0 if the hash is unknown.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CacheAsset c SET c.referenceCount = c.referenceCount + 1, c.lastAccessedAt = :now " +
           "WHERE c.contentHash = :contentHash")
    int incrementReferences(String contentHash, Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE CacheAsset c SET c.referenceCount = c.referenceCount - 1 " +
           "WHERE c.id = :id AND c.referenceCount > 0")
    int decrementReferences(Long id);

    @Query("SELECT COALESCE(SUM(c.fileSize), 0) FROM CacheAsset c")
    long totalFileSize();
}
