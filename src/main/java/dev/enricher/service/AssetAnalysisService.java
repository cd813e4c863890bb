package dev.enricher.service;

import dev.enricher.exception.EnricherException;
import dev.enricher.model.AnalyzedAsset;
import dev.enricher.provider.AssetInfo;
import dev.enricher.util.ContentHash;
import dev.enricher.util.MimeTypes;
import dev.enricher.util.PerceptualHash;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Downloads one asset candidate, extracts what scoring needs (dimensions and perceptual hash for
 * images, duration for videos) and moves the content into the cache. Only the cache id leaves
 * this service, so memory held per candidate ends with its analysis.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssetAnalysisService {

    private final AssetDownloader downloader;
    private final ContentAddressedStore contentStore;

    /**
     * The temp file is deleted whether analysis succeeds, fails or is cancelled.
     */
    public Mono<AnalyzedAsset> analyze(AssetInfo info) {
        return Mono.usingWhen(
                downloader.download(info.url()),
                path -> Mono.fromCallable(() -> inspect(info, path)).subscribeOn(Schedulers.boundedElastic()),
                downloader::delete);
    }

    /**
     * Give up the cache reference of an asset that will not become a candidate.
     */
    public void release(AnalyzedAsset asset) {
        try {
            contentStore.release(asset.cacheAssetId());
        } catch (RuntimeException e) {
            log.warn("Could not release cached content {} of {}: {}", asset.cacheAssetId(), asset.source().url(),
                    e.getMessage());
        }
    }

    AnalyzedAsset inspect(AssetInfo info, Path path) throws IOException {
        byte[] content = Files.readAllBytes(path);
        String hash = ContentHash.sha256Hex(content);

        if (info.isVideo()) {
            String mimeType = MimeTypes.fromUrl(info.url());
            long cacheAssetId = contentStore.store(content, mimeType, info.width(), info.height(), null);
            return new AnalyzedAsset(info, hash, cacheAssetId, mimeType,
                    info.width(), info.height(), null, info.durationSeconds());
        }

        String format = imageFormat(content);
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
        if (format == null || image == null) {
            throw new EnricherException("Not a decodable image: " + info.url());
        }
        String mimeType = MimeTypes.fromImageFormat(format);
        long perceptualHash = PerceptualHash.averageHash(image);
        long cacheAssetId = contentStore.store(content, mimeType, image.getWidth(), image.getHeight(), perceptualHash);
        return new AnalyzedAsset(info, hash, cacheAssetId, mimeType,
                image.getWidth(), image.getHeight(), perceptualHash, null);
    }

    private static String imageFormat(byte[] content) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(content))) {
            if (input == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                return reader.getFormatName();
            } finally {
                reader.dispose();
            }
        }
    }
}
