package dev.enricher.service;

import dev.enricher.QueueRunner;
import dev.enricher.entity.CacheAsset;
import dev.enricher.repository.AssetCandidateRepository;
import dev.enricher.repository.CacheAssetRepository;
import dev.enricher.support.TestClockConfig;
import dev.enricher.util.ContentHash;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class ContentAddressedStoreTest {

    @MockitoBean
    private QueueRunner queueRunner;

    @Autowired
    private ContentAddressedStore store;

    @Autowired
    private CacheAssetRepository cacheAssetRepository;

    @Autowired
    private AssetCandidateRepository candidateRepository;

    @BeforeEach
    void setUp() {
        candidateRepository.deleteAll();
        cacheAssetRepository.deleteAll();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should store identical content once and count references")
    void shouldDeduplicateIdenticalContent() {
        byte[] content = bytes("poster-bytes-" + System.nanoTime());

        long first = store.store(content, "image/jpeg");
        long second = store.store(content.clone(), "image/jpeg");

        assertThat(second).isEqualTo(first);
        assertThat(cacheAssetRepository.count()).isEqualTo(1);
        CacheAsset asset = store.get(first).orElseThrow();
        assertThat(asset.getReferenceCount()).isEqualTo(2);
        assertThat(asset.getContentHash()).isEqualTo(ContentHash.sha256Hex(content));
        assertThat(asset.getFileSize()).isEqualTo(content.length);
    }

    @Test
    @DisplayName("Should lay files out by hash prefix")
    void shouldWriteFileUnderHashPrefix() throws Exception {
        byte[] content = bytes("fanart-bytes-" + System.nanoTime());
        String hash = ContentHash.sha256Hex(content);

        long id = store.store(content, "image/png");

        Path file = Path.of(store.get(id).orElseThrow().getFilePath());
        assertThat(file).isEqualTo(store.pathFor(hash, "image/png"));
        assertThat(file.getParent().getFileName().toString()).isEqualTo(hash.substring(0, 2));
        assertThat(file.getFileName().toString()).isEqualTo(hash + ".png");
        assertThat(Files.readAllBytes(file)).isEqualTo(content);
    }

    @Test
    @DisplayName("Should delete row and file only when the last reference is released")
    void shouldReleaseReferences() {
        byte[] content = bytes("logo-bytes-" + System.nanoTime());
        long id = store.store(content, "image/png");
        store.store(content, "image/png");
        Path file = Path.of(store.get(id).orElseThrow().getFilePath());

        assertThat(store.release(id)).isEqualTo(1);
        assertThat(Files.exists(file)).isTrue();

        assertThat(store.release(id)).isZero();
        assertThat(store.get(id)).isEmpty();
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    @DisplayName("Should write the file again when content returns after its last release")
    void shouldRecreateFileAfterRelease() throws Exception {
        byte[] content = bytes("backdrop-bytes-" + System.nanoTime());
        long first = store.store(content, "image/jpeg");
        Path file = Path.of(store.get(first).orElseThrow().getFilePath());
        store.release(first);
        assertThat(Files.exists(file)).isFalse();

        long second = store.store(content, "image/jpeg");

        assertThat(Path.of(store.get(second).orElseThrow().getFilePath())).isEqualTo(file);
        assertThat(Files.readAllBytes(file)).isEqualTo(content);
    }

    @Test
    @DisplayName("Should never leave a held entry without its file while others store and release the same content")
    void shouldKeepFileWhileReferenced() throws Exception {
        byte[] content = bytes("contended-bytes-" + System.nanoTime());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                results.add(executor.submit(() -> {
                    int missing = 0;
                    for (int i = 0; i < 25; i++) {
                        long id = store.store(content, "image/jpeg");
                        Path file = Path.of(store.get(id).orElseThrow().getFilePath());
                        if (!Files.exists(file)) {
                            missing++;
                        }
                        store.release(id);
                    }
                    return missing;
                }));
            }
            for (Future<Integer> result : results) {
                assertThat(result.get(60, TimeUnit.SECONDS)).isZero();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.find(ContentHash.sha256Hex(content))).isEmpty();
    }

    @Test
    @DisplayName("Should keep distinct content apart and report totals")
    void shouldReportStats() {
        byte[] a = bytes("a-" + System.nanoTime());
        byte[] b = bytes("bb-" + System.nanoTime());

        store.store(a, "image/jpeg");
        store.store(b, "image/jpeg");

        ContentAddressedStore.CacheStats stats = store.getStats();
        assertThat(stats.entries()).isEqualTo(2);
        assertThat(stats.totalBytes()).isEqualTo(a.length + b.length);
    }
}
