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
 * User-editable settings of one provider. The registry keeps one cached instance per row.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "provider_configs")
public class ProviderConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String providerName;

    @Column(nullable = false)
    private boolean enabled;

    @Column(length = 512)
    private String apiKey;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    private List<String> enabledAssetTypes = new ArrayList<>();

    @Column(length = 500)
    private String lastTestStatus;

    private Instant lastTestedAt;

    private Instant updatedAt;

    /**
     * An empty list means every asset type the provider declares.
     */
    public boolean isAssetTypeEnabled(String assetType) {
        return enabledAssetTypes == null || enabledAssetTypes.isEmpty() || enabledAssetTypes.contains(assetType);
    }
}
