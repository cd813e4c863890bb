package dev.enricher.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.JobPriority;
import dev.enricher.model.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobPayloadValidatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobPayloadValidator validator = new JobPayloadValidator();

    private ObjectNode enrichPayload(String entityType, long entityId) {
        return objectMapper.createObjectNode().put("entityType", entityType).put("entityId", entityId);
    }

    @Test
    @DisplayName("Should accept a complete enrichment payload")
    void shouldAcceptValidPayload() {
        assertThatCode(() -> validator.validate(JobType.ENRICH_METADATA, enrichPayload("movie", 42), JobPriority.NORMAL))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should report every missing field")
    void shouldRejectMissingFields() {
        assertThatThrownBy(() -> validator.validate(JobType.ENRICH_METADATA, objectMapper.createObjectNode(), 5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("entityType is required")
                .hasMessageContaining("entityId is required");
    }

    @Test
    @DisplayName("Should reject a field of the wrong kind")
    void shouldRejectWrongKind() {
        ObjectNode payload = objectMapper.createObjectNode().put("entityType", "movie").put("entityId", "42");

        assertThatThrownBy(() -> validator.validate(JobType.ENRICH_METADATA, payload, 5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("entityId must be number");
    }

    @Test
    @DisplayName("Should reject unknown entity types and non-positive ids")
    void shouldRejectUnknownEntityType() {
        assertThatThrownBy(() -> validator.validate(JobType.ENRICH_METADATA, enrichPayload("podcast", 42), 5))
                .hasMessageContaining("podcast");
        assertThatThrownBy(() -> validator.validate(JobType.ENRICH_METADATA, enrichPayload("movie", 0), 5))
                .hasMessageContaining("entityId must be positive");
    }

    @Test
    @DisplayName("Should reject priorities outside 1..10")
    void shouldRejectPriorityOutOfRange() {
        ObjectNode payload = objectMapper.createObjectNode().put("manual", true);

        assertThatThrownBy(() -> validator.validate(JobType.SCHEDULED_CLEANUP, payload, 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(JobType.SCHEDULED_CLEANUP, payload, 11))
                .isInstanceOf(ValidationException.class);
        assertThatCode(() -> validator.validate(JobType.SCHEDULED_CLEANUP, payload, 10))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject a payload that is not an object")
    void shouldRejectNonObjectPayload() {
        assertThatThrownBy(() -> validator.validate(JobType.SCHEDULED_CLEANUP, objectMapper.createArrayNode(), 5))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("JSON object");
    }
}
