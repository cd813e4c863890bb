package dev.enricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider resilience settings and default provider order.
 * Loaded from application.yml under 'providers' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "providers")
public class ProvidersConfig {

    /**
     * Order used for a metadata field or asset type with no user-configured priority.
     */
    private List<String> defaultOrder = new ArrayList<>(List.of("tmdb", "tvdb", "fanart", "omdb", "musicbrainz"));

    private long timeoutMs = 10_000;
    private int maxRetries = 3;
    private long retryBaseDelayMs = 1000;
    private long retryMaxDelayMs = 30_000;

    private int circuitThreshold = 5;
    private long circuitResetTimeoutMs = 60_000;

    private int fetchConcurrency = 10;
}
