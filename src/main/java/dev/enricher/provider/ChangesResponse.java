package dev.enricher.provider;

import java.util.List;

public record ChangesResponse(boolean hasChanges, List<String> changedFields) {

    public ChangesResponse {
        changedFields = changedFields == null ? List.of() : List.copyOf(changedFields);
    }

    public static ChangesResponse none() {
        return new ChangesResponse(false, List.of());
    }
}
