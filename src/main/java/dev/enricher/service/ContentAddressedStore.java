package dev.enricher.service;

import dev.enricher.config.CacheConfig;
import dev.enricher.entity.CacheAsset;
import dev.enricher.metrics.EnricherMetrics;
import dev.enricher.repository.CacheAssetRepository;
import dev.enricher.util.ContentHash;
import dev.enricher.util.MimeTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asset bytes keyed by SHA-256. Identical content is stored once and reference counted, so
 * storage grows with distinct content rather than with distinct source URLs.
 *
 * <p>Files live at {@code <baseDir>/<first two hex chars>/<hash>.<ext>}. Creating an entry and
 * deleting the last reference to one hold the same per-hash lock, so a file is never deleted
 * under a row that was just inserted for it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContentAddressedStore {

    private final CacheAssetRepository repository;
    private final CacheConfig cacheConfig;
    private final TransactionTemplate transactionTemplate;
    private final EnricherMetrics metrics;
    private final Clock clock;
    private final Lock[] hashLocks = newLocks(64);

    public long store(byte[] content, String mimeType) {
        return store(content, mimeType, null, null, null);
    }

    /**
     * Store content, or add a reference if identical content is already cached.
     *
     * @return id of the cache entry holding the content
     */
    public long store(byte[] content, String mimeType, Integer width, Integer height, Long perceptualHash) {
        String hash = ContentHash.sha256Hex(content);

        Optional<Long> existing = addReference(hash);
        if (existing.isPresent()) {
            metrics.recordCacheDeduplicated();
            log.debug("Content {} already cached, reference added", hash);
            return existing.get();
        }

        Lock lock = lockFor(hash);
        lock.lock();
        try {
            return insert(hash, content, mimeType, width, height, perceptualHash);
        } finally {
            lock.unlock();
        }
    }

    private long insert(String hash, byte[] content, String mimeType, Integer width, Integer height,
                        Long perceptualHash) {
        Optional<Long> existing = addReference(hash);
        if (existing.isPresent()) {
            metrics.recordCacheDeduplicated();
            return existing.get();
        }

        Path file = writeFile(hash, mimeType, content);
        try {
            CacheAsset saved = transactionTemplate.execute(status -> repository.saveAndFlush(CacheAsset.builder()
                    .contentHash(hash)
                    .filePath(file.toString())
                    .fileSize(content.length)
                    .mimeType(mimeType)
                    .referenceCount(1)
                    .width(width)
                    .height(height)
                    .perceptualHash(perceptualHash)
                    .createdAt(clock.instant())
                    .lastAccessedAt(clock.instant())
                    .build()));
            metrics.recordCacheStored();
            log.debug("Cached {} ({} bytes) at {}", hash, content.length, file);
            return saved.getId();
        } catch (DataIntegrityViolationException e) {
            // Another writer inserted the same hash first; its file has the same bytes.
            log.debug("Concurrent insert of {}, adding a reference instead", hash);
            Long id = addReference(hash).orElseThrow(() -> e);
            metrics.recordCacheDeduplicated();
            return id;
        }
    }

    /**
     * Drop one reference. The row and its file are deleted when none remain.
     *
     * @return references left
     */
    public int release(long cacheAssetId) {
        Optional<String> hash = repository.findById(cacheAssetId).map(CacheAsset::getContentHash);
        if (hash.isEmpty()) {
            log.debug("Cache entry {} already gone", cacheAssetId);
            return 0;
        }
        Lock lock = lockFor(hash.get());
        lock.lock();
        try {
            return decrement(cacheAssetId);
        } finally {
            lock.unlock();
        }
    }

    private int decrement(long cacheAssetId) {
        Optional<CacheAsset> removed = transactionTemplate.execute(status -> {
            repository.decrementReferences(cacheAssetId);
            Optional<CacheAsset> asset = repository.findById(cacheAssetId);
            if (asset.isPresent() && asset.get().getReferenceCount() <= 0) {
                repository.delete(asset.get());
                return asset;
            }
            return Optional.<CacheAsset>empty();
        });

        if (removed != null && removed.isPresent()) {
            deleteFile(Path.of(removed.get().getFilePath()));
            metrics.recordCacheReleased();
            log.debug("Released last reference to {}", removed.get().getContentHash());
            return 0;
        }
        return repository.findById(cacheAssetId).map(CacheAsset::getReferenceCount).orElse(0);
    }

    public Optional<CacheAsset> find(String contentHash) {
        return repository.findByContentHash(contentHash);
    }

    public Optional<CacheAsset> get(long cacheAssetId) {
        return repository.findById(cacheAssetId);
    }

    public CacheStats getStats() {
        return new CacheStats(repository.count(), repository.totalFileSize());
    }

    private Optional<Long> addReference(String hash) {
        Optional<Long> id = transactionTemplate.execute(status -> {
            if (repository.incrementReferences(hash, clock.instant()) == 0) {
                return Optional.<Long>empty();
            }
            return repository.findByContentHash(hash).map(CacheAsset::getId);
        });
        return id == null ? Optional.empty() : id;
    }

    Path pathFor(String hash, String mimeType) {
        return Path.of(cacheConfig.getBaseDir(), hash.substring(0, 2), hash + "." + MimeTypes.extensionFor(mimeType));
    }

    private Lock lockFor(String hash) {
        return hashLocks[Math.floorMod(hash.hashCode(), hashLocks.length)];
    }

    private static Lock[] newLocks(int stripes) {
        Lock[] locks = new Lock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    private Path writeFile(String hash, String mimeType, byte[] content) {
        Path target = pathFor(hash, mimeType);
        try {
            Files.createDirectories(target.getParent());
            Path partial = Files.createTempFile(target.getParent(), hash, ".part");
            Files.write(partial, content);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write cache file " + target, e);
        }
    }

    private void deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete cache file {}: {}", file, e.getMessage());
        }
    }

    public record CacheStats(long entries, long totalBytes) {
    }
}
