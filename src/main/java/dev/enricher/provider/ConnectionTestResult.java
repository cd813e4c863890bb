package dev.enricher.provider;

public record ConnectionTestResult(boolean success, String message) {
}
