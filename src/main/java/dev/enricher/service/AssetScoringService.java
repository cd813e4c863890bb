package dev.enricher.service;

import dev.enricher.config.ScoringConfig;
import dev.enricher.model.AnalyzedAsset;
import dev.enricher.model.ScoredAsset;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Deterministic asset scoring.
 *
 * <pre>
 * score = (wRes * resolution + wVotes * votes + wLang * language) * providerMultiplier
 * resolution = area / (area + halfArea) * 100
 * votes = (voteAverage / 10) * min(log1p(voteCount) / log1p(saturation), 1) * 100
 * providerMultiplier = 1 + boost * (n - index) / n
 * </pre>
 */
@Service
@RequiredArgsConstructor
public class AssetScoringService {

    private final ScoringConfig config;

    public double score(AnalyzedAsset asset, List<String> providerOrder) {
        double base = config.getResolutionWeight() * resolutionScore(asset.area())
                + config.getVotesWeight() * voteScore(asset.source().voteAverage(), asset.source().voteCount())
                + config.getLanguageWeight() * languageScore(asset.source().language());
        return base * providerMultiplier(asset.source().providerName(), providerOrder);
    }

    double resolutionScore(long area) {
        if (area <= 0) {
            return 0;
        }
        double halfArea = Math.max(1, config.getResolutionHalfArea());
        return area / (area + halfArea) * 100;
    }

    double voteScore(Double voteAverage, Integer voteCount) {
        if (voteAverage == null || voteCount == null || voteCount <= 0) {
            return 0;
        }
        double average = Math.max(0, Math.min(voteAverage, 10));
        double confidence = Math.min(Math.log1p(voteCount) / Math.log1p(config.getVoteCountSaturation()), 1.0);
        return (average / 10) * confidence * 100;
    }

    double languageScore(String language) {
        if (language == null || language.isBlank() || "xx".equalsIgnoreCase(language)) {
            return config.getNeutralLanguageScore();
        }
        if (language.equalsIgnoreCase(config.getPreferredLanguage())) {
            return config.getPreferredLanguageScore();
        }
        return config.getOtherLanguageScore();
    }

    double providerMultiplier(String provider, List<String> providerOrder) {
        int index = providerOrder.indexOf(provider);
        if (index < 0) {
            return 1.0;
        }
        int n = providerOrder.size();
        return 1.0 + config.getProviderPriorityBoost() * (n - index) / n;
    }

    /**
     * Score a batch, highest first. Near-duplicates are all kept; they are collapsed when a
     * candidate is selected.
     */
    public List<ScoredAsset> scoreAll(List<AnalyzedAsset> assets, List<String> providerOrder) {
        return assets.stream()
                .map(asset -> new ScoredAsset(asset, score(asset, providerOrder)))
                .sorted(Comparator.comparingDouble(ScoredAsset::score).reversed()
                        .thenComparing(s -> s.asset().area(), Comparator.reverseOrder())
                        .thenComparing(s -> s.asset().source().providerName()))
                .toList();
    }
}
