package dev.enricher.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One distinct byte sequence in the content-addressed cache.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "cache_assets", indexes = @Index(name = "idx_cache_assets_refs", columnList = "referenceCount"))
public class CacheAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String contentHash;

    @Column(nullable = false, length = 1024)
    private String filePath;

    @Column(nullable = false)
    private long fileSize;

    @Column(nullable = false, length = 64)
    private String mimeType;

    @Column(nullable = false)
    private int referenceCount;

    private Integer width;

    private Integer height;

    private Long perceptualHash;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant lastAccessedAt;
}
