package com.modelmonitor.retraining;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.enums.RetrainingTrigger;
import com.modelmonitor.domain.model.RetrainingJob;
import com.modelmonitor.exception.MalformedJobPayloadException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Versioned JSON encoding of {@link RetrainingJob} queue payloads.
 *
 * <p>Payloads are plain JSON objects tagged with {@code "schema": "retraining-job/v1"}. Decoding
 * reads each field explicitly and never instantiates types named by the payload. Anything other
 * than an exact v1 document raises {@link MalformedJobPayloadException}.
 */
@Component
public class RetrainingJobCodec {

    public static final String SCHEMA = "retraining-job/v1";

    private static final Set<String> FIELDS = Set.of(
            "schema", "id", "model", "trigger", "issues", "metrics", "enqueuedAt", "attemptCount");

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public String encode(RetrainingJob job) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put("schema", SCHEMA);
        root.put("id", job.getId());
        root.put("model", job.getModelIdentity().getKey());
        root.put("trigger", job.getTrigger().name());
        ArrayNode issues = root.putArray("issues");
        job.getIssues().forEach(issues::add);
        ObjectNode metrics = root.putObject("metrics");
        job.getMetrics().forEach(metrics::put);
        root.put("enqueuedAt", job.getEnqueuedAt().toString());
        root.put("attemptCount", job.getAttemptCount());
        try {
            return OBJECT_MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode retraining job " + job.getId(), e);
        }
    }

    public RetrainingJob decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedJobPayloadException("Empty retraining job payload");
        }

        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new MalformedJobPayloadException("Retraining job payload is not JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedJobPayloadException("Retraining job payload is not a JSON object");
        }

        for (Map.Entry<String, JsonNode> field : root.properties()) {
            if (!FIELDS.contains(field.getKey())) {
                throw new MalformedJobPayloadException(
                        "Unknown field '" + field.getKey() + "' in retraining job payload");
            }
        }

        String schema = requiredText(root, "schema");
        if (!SCHEMA.equals(schema)) {
            throw new MalformedJobPayloadException("Unsupported retraining job schema '" + schema + "'");
        }

        try {
            return RetrainingJob.builder()
                    .id(requiredText(root, "id"))
                    .modelIdentity(ModelIdentity.fromKey(requiredText(root, "model")))
                    .trigger(RetrainingTrigger.valueOf(requiredText(root, "trigger")))
                    .issues(issues(root))
                    .metrics(metrics(root))
                    .enqueuedAt(Instant.parse(requiredText(root, "enqueuedAt")))
                    .attemptCount(attemptCount(root))
                    .build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new MalformedJobPayloadException("Invalid retraining job payload: " + e.getMessage(), e);
        }
    }

    private String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) {
            throw new MalformedJobPayloadException("Missing or non-text field '" + field + "'");
        }
        return node.asText();
    }

    private List<String> issues(JsonNode root) {
        JsonNode node = root.get("issues");
        if (node == null || !node.isArray()) {
            throw new MalformedJobPayloadException("Missing or non-array field 'issues'");
        }
        List<String> issues = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new MalformedJobPayloadException("Non-text element in 'issues'");
            }
            issues.add(element.asText());
        }
        return List.copyOf(issues);
    }

    private Map<String, Double> metrics(JsonNode root) {
        JsonNode node = root.get("metrics");
        if (node == null || !node.isObject()) {
            throw new MalformedJobPayloadException("Missing or non-object field 'metrics'");
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> field : node.properties()) {
            if (!field.getValue().isNumber()) {
                throw new MalformedJobPayloadException("Non-numeric metric '" + field.getKey() + "'");
            }
            metrics.put(field.getKey(), field.getValue().doubleValue());
        }
        return metrics;
    }

    private int attemptCount(JsonNode root) {
        JsonNode node = root.get("attemptCount");
        if (node == null || !node.isInt() || node.intValue() < 0) {
            throw new MalformedJobPayloadException("Missing or invalid field 'attemptCount'");
        }
        return node.intValue();
    }
}
