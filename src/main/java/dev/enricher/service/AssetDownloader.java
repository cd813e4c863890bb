package dev.enricher.service;

import dev.enricher.config.CacheConfig;
import dev.enricher.exception.EnricherException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Streams provider assets into temp files. Callers own the returned file and must
 * {@link #delete(Path)} it; anything they miss is removed by {@link #sweepStaleTempFiles()}.
 */
@Slf4j
@Component
public class AssetDownloader {

    private static final String TEMP_PREFIX = "asset-";

    private final WebClient webClient;
    private final CacheConfig cacheConfig;

    public AssetDownloader(WebClient.Builder webClientBuilder, CacheConfig cacheConfig) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(true)
                .responseTimeout(Duration.ofSeconds(cacheConfig.getDownloadTimeoutSeconds()));

        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader("User-Agent", "media-enricher/1.0")
                .defaultHeader("Accept", "image/*, video/*, */*")
                .build();
        this.cacheConfig = cacheConfig;
    }

    /**
     * Download a URL into a new temp file. On error the partial file is already deleted.
     */
    public Mono<Path> download(String url) {
        return Mono.fromCallable(this::createTempFile)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(path -> DataBufferUtils.write(fetch(url), path)
                        .then(Mono.fromCallable(() -> checkSize(url, path)))
                        .timeout(Duration.ofSeconds(cacheConfig.getDownloadTimeoutSeconds()))
                        .onErrorResume(e -> delete(path).then(Mono.error(e))));
    }

    private Flux<DataBuffer> fetch(String url) {
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToFlux(DataBuffer.class);
    }

    private Path checkSize(String url, Path path) throws IOException {
        long size = Files.size(path);
        if (size == 0) {
            throw new EnricherException("Empty response from " + url);
        }
        if (size > cacheConfig.getMaxDownloadBytes()) {
            throw new EnricherException("Asset at " + url + " exceeds " + cacheConfig.getMaxDownloadBytes() + " bytes");
        }
        return path;
    }

    public Mono<Void> delete(Path path) {
        return Mono.fromRunnable(() -> deleteQuietly(path))
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    /**
     * Remove temp files older than the configured maximum age.
     *
     * @return number of files deleted
     */
    public int sweepStaleTempFiles() {
        Path dir = tempDir();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(Duration.ofMinutes(cacheConfig.getTempMaxAgeMinutes()));
        List<Path> stale;
        try (Stream<Path> files = Files.list(dir)) {
            stale = files
                    .filter(p -> p.getFileName().toString().startsWith(TEMP_PREFIX))
                    .filter(p -> isOlderThan(p, cutoff))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list temp directory " + dir, e);
        }
        stale.forEach(this::deleteQuietly);
        if (!stale.isEmpty()) {
            log.info("Removed {} stale temp files from {}", stale.size(), dir);
        }
        return stale.size();
    }

    private Path createTempFile() throws IOException {
        Path dir = tempDir();
        Files.createDirectories(dir);
        return Files.createTempFile(dir, TEMP_PREFIX, ".tmp");
    }

    private Path tempDir() {
        return Path.of(cacheConfig.getTempDir());
    }

    private static boolean isOlderThan(Path path, Instant cutoff) {
        try {
            FileTime modified = Files.getLastModifiedTime(path);
            return modified.toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.debug("Could not read modification time of {}: {}", path, e.getMessage());
            return false;
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", path, e.getMessage());
        }
    }
}
