package dev.enricher.model;

public record ScoredAsset(AnalyzedAsset asset, double score) {
}
