package dev.enricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Content-addressed cache and download settings.
 * Loaded from application.yml under 'cache' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "cache")
public class CacheConfig {

    private String baseDir = "data/cache";
    private String tempDir = "data/temp";
    private int tempMaxAgeMinutes = 60;

    private int downloadTimeoutSeconds = 30;
    private int maxDownloadBytes = 50 * 1024 * 1024;
    private int analysisConcurrency = 10;
}
