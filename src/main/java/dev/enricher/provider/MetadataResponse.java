package dev.enricher.provider;

import java.time.Instant;
import java.util.Map;

/**
 * Field values returned by one provider. Null or blank values count as absent.
 */
public record MetadataResponse(String providerName, String externalId, Map<String, Object> fields, Instant fetchedAt) {

    public MetadataResponse {
        fields = fields == null ? Map.of() : fields;
    }

    public boolean hasField(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return false;
        }
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof java.util.Collection<?> collection) {
            return !collection.isEmpty();
        }
        return true;
    }
}
