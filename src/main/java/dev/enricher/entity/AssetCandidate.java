package dev.enricher.entity;

import dev.enricher.model.EntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A scored provider asset for one (entity, asset type). Blocked rows are kept for audit and for
 * manual override; at most one non-blocked row per group is selected.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "asset_candidates",
        uniqueConstraints = @UniqueConstraint(name = "uk_candidate_url",
                columnNames = {"entityType", "entityId", "assetType", "url"}),
        indexes = {
                @Index(name = "idx_candidates_entity", columnList = "entityType, entityId, assetType"),
                @Index(name = "idx_candidates_content", columnList = "contentHash")
        })
public class AssetCandidate {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntityType entityType;

    @Column(nullable = false)
    private long entityId;

    @Column(nullable = false, length = 32)
    private String assetType;

    @Column(nullable = false, length = 64)
    private String provider;

    @Column(nullable = false, length = 2048)
    private String url;

    private Integer width;

    private Integer height;

    @Column(length = 16)
    private String language;

    private Double voteAverage;

    private Integer voteCount;

    private Integer durationSeconds;

    @Column(nullable = false)
    private double score;

    private Long cacheAssetId;

    @Column(length = 64)
    private String contentHash;

    private Long perceptualHash;

    @Column(nullable = false)
    private boolean selected;

    @Column(nullable = false)
    private boolean blocked;

    @Column(length = 32)
    private String selectedBy;

    private Instant selectedAt;

    @Column(length = 32)
    private String blockedBy;

    private Instant blockedAt;

    @Column(nullable = false)
    private Instant lastRefreshed;

    public long area() {
        if (width == null || height == null) {
            return 0L;
        }
        return (long) width * height;
    }
}
