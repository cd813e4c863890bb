package dev.enricher.entity;

import dev.enricher.model.EntityType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "provider_refresh_log",
        uniqueConstraints = @UniqueConstraint(name = "uk_refresh_entity_provider",
                columnNames = {"entityType", "entityId", "provider"}),
        indexes = @Index(name = "idx_refresh_needs", columnList = "needsRefresh, lastChecked"))
public class ProviderRefreshLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntityType entityType;

    @Column(nullable = false)
    private long entityId;

    @Column(nullable = false, length = 64)
    private String provider;

    @Column(nullable = false)
    private Instant lastChecked;

    @Column(nullable = false)
    private boolean needsRefresh;
}
