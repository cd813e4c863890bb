package dev.enricher.queue;

import com.fasterxml.jackson.databind.JsonNode;
import dev.enricher.exception.ValidationException;
import dev.enricher.model.EntityType;
import dev.enricher.model.JobPriority;
import dev.enricher.model.JobType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a job payload against the fields its type requires.
 */
@Component
public class JobPayloadValidator {

    public void validate(JobType type, JsonNode payload, int priority) {
        if (type == null) {
            throw new ValidationException("Job type is required");
        }
        if (priority < JobPriority.MIN || priority > JobPriority.MAX) {
            throw new ValidationException("Priority must be between " + JobPriority.MIN + " and "
                    + JobPriority.MAX + ", got " + priority);
        }
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("Payload for " + type.getCode() + " must be a JSON object");
        }

        List<String> problems = new ArrayList<>();
        for (Map.Entry<String, JobType.PayloadKind> field : type.getRequiredFields().entrySet()) {
            JsonNode value = payload.get(field.getKey());
            if (value == null || value.isNull()) {
                problems.add(field.getKey() + " is required");
            } else if (!field.getValue().matches(value)) {
                problems.add(field.getKey() + " must be " + field.getValue().name().toLowerCase());
            }
        }

        if (type == JobType.ENRICH_METADATA && problems.isEmpty()) {
            String entityType = payload.get("entityType").asText();
            if (EntityType.parse(entityType).isEmpty()) {
                problems.add("entityType '" + entityType + "' is not a known entity type");
            }
            if (payload.get("entityId").asLong() <= 0) {
                problems.add("entityId must be positive");
            }
        }

        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid payload for " + type.getCode() + ": " + String.join("; ", problems));
        }
    }
}
