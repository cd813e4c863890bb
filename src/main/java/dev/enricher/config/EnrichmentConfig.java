package dev.enricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Staleness gate and default enrichment scope.
 * Loaded from application.yml under 'enrichment' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentConfig {

    private int staleDataThresholdDays = 7;
    private int forceRescrapeAfterDays = 30;
    private boolean changeDetectionEnabled = true;

    private List<String> metadataFields = new ArrayList<>(List.of(
            "title", "original_title", "overview", "tagline", "release_date", "runtime",
            "genres", "studios", "rating", "certification"));
    private List<String> assetTypes = new ArrayList<>(List.of("poster", "fanart", "clearlogo"));
}
