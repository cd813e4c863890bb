package dev.enricher.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Job types known to the queue, each with the payload fields it requires.
 */
@Getter
public enum JobType {

    ENRICH_METADATA("enrich-metadata", fields("entityType", PayloadKind.TEXT, "entityId", PayloadKind.NUMBER)),
    SCHEDULED_PROVIDER_UPDATE("scheduled-provider-update", fields("manual", PayloadKind.BOOLEAN)),
    SCHEDULED_CLEANUP("scheduled-cleanup", fields("manual", PayloadKind.BOOLEAN));

    private final String code;
    private final Map<String, PayloadKind> requiredFields;

    JobType(String code, Map<String, PayloadKind> requiredFields) {
        this.code = code;
        this.requiredFields = requiredFields;
    }

    public static Optional<JobType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }

    private static Map<String, PayloadKind> fields(Object... pairs) {
        Map<String, PayloadKind> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (PayloadKind) pairs[i + 1]);
        }
        return Map.copyOf(map);
    }

    /**
     * JSON kinds a required payload field may have.
     */
    public enum PayloadKind {
        TEXT,
        NUMBER,
        BOOLEAN;

        public boolean matches(JsonNode node) {
            return switch (this) {
                case TEXT -> node.isTextual() && !node.asText().isBlank();
                case NUMBER -> node.isIntegralNumber();
                case BOOLEAN -> node.isBoolean();
            };
        }
    }
}
