package dev.enricher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Weights of the asset scoring formula.
 * Loaded from application.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double resolutionWeight = 0.4;
    private double votesWeight = 0.4;
    private double languageWeight = 0.2;

    /**
     * Area scoring half of the resolution factor (1920x1080). The factor keeps rising above it.
     */
    private long resolutionHalfArea = 1920L * 1080L;

    /**
     * Vote count at which the confidence damping saturates.
     */
    private int voteCountSaturation = 500;

    private String preferredLanguage = "en";
    private double preferredLanguageScore = 100;
    private double neutralLanguageScore = 70;
    private double otherLanguageScore = 30;

    /**
     * Extra multiplier given to the top provider of an asset type; decreases linearly down the order.
     */
    private double providerPriorityBoost = 0.1;

    private int duplicateMaxDistance = 5;
}
