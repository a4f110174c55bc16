package com.modelmonitor.trainer;

import com.fasterxml.jackson.databind.JsonNode;
import com.modelmonitor.config.TrainerProperties;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.TrainingResult;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * {@link Trainer} backed by the external training pipeline service.
 *
 * <p>POSTs {@code {"model": "<key>"}} to {@code {base-url}{run-path}} and maps the response:
 * <pre>
 * {"status": "success", "evaluation_results": {"mape": 9.1, ...}}
 * {"status": "error", "error": "..."}
 * </pre>
 * Nested numeric evaluation results are flattened into dotted metric names.
 */
@Component
public class RemoteTrainingPipelineClient implements Trainer {

    private static final Logger log = LoggerFactory.getLogger(RemoteTrainingPipelineClient.class);

    private final RestTemplate restTemplate;
    private final TrainerProperties trainerProperties;

    public RemoteTrainingPipelineClient(RestTemplateBuilder restTemplateBuilder, TrainerProperties trainerProperties) {
        this.trainerProperties = trainerProperties;
        this.restTemplate = restTemplateBuilder
                .connectTimeout(trainerProperties.getConnectTimeout())
                .readTimeout(trainerProperties.getReadTimeout())
                .build();
    }

    @Override
    public TrainingResult train(ModelIdentity modelIdentity) {
        String url = trainerProperties.getBaseUrl() + trainerProperties.getRunPath();
        log.info("Starting retraining for {} via {}", modelIdentity.getKey(), url);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(Map.of("model", modelIdentity.getKey()), headers);

        JsonNode response = restTemplate.postForObject(url, request, JsonNode.class);
        return toResult(response);
    }

    static TrainingResult toResult(JsonNode response) {
        if (response == null) {
            return TrainingResult.error("Empty response from training pipeline");
        }
        String status = response.path("status").asText("");
        if (!"success".equalsIgnoreCase(status)) {
            return TrainingResult.error(response.path("error").asText("Unknown error"));
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        flatten("", response.path("evaluation_results"), metrics);
        return TrainingResult.success(metrics);
    }

    private static void flatten(String prefix, JsonNode node, Map<String, Double> metrics) {
        if (node.isNumber()) {
            metrics.put(prefix, node.doubleValue());
        } else if (node.isObject()) {
            for (Map.Entry<String, JsonNode> field : node.properties()) {
                String name = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
                flatten(name, field.getValue(), metrics);
            }
        }
    }
}
