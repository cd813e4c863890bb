package dev.enricher.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * User-configured provider order for one asset type. Feeds the scoring tie-break multiplier.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "asset_type_priorities")
public class AssetTypePriority {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 32)
    private String assetType;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 1000)
    private List<String> providerOrder = new ArrayList<>();

    private Instant updatedAt;
}
