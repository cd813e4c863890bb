package dev.enricher.entity;

import dev.enricher.model.EnrichmentTarget;
import dev.enricher.model.EntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A library entity (movie, series, album...) that the pipeline enriches.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "media_items", indexes = {
        @Index(name = "idx_media_tmdb", columnList = "tmdbId"),
        @Index(name = "idx_media_imdb", columnList = "imdbId")
})
public class MediaItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntityType entityType;

    @Column(nullable = false, length = 500)
    private String title;

    private Integer year;

    @Column(length = 32)
    private String tmdbId;

    @Column(length = 32)
    private String imdbId;

    @Column(length = 32)
    private String tvdbId;

    @Column(length = 64)
    private String musicbrainzId;

    /**
     * Merged metadata fields as JSON.
     */
    @Lob
    private String metadata;

    private Instant lastScrapedAt;

    public EnrichmentTarget toTarget() {
        Map<String, String> ids = new LinkedHashMap<>();
        putIfPresent(ids, "tmdb_id", tmdbId);
        putIfPresent(ids, "imdb_id", imdbId);
        putIfPresent(ids, "tvdb_id", tvdbId);
        putIfPresent(ids, "musicbrainz_id", musicbrainzId);
        return new EnrichmentTarget(entityType, id, title, year, ids);
    }

    private static void putIfPresent(Map<String, String> ids, String key, String value) {
        if (value != null && !value.isBlank()) {
            ids.put(key, value);
        }
    }
}
