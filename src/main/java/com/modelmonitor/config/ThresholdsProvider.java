package com.modelmonitor.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.ModelThresholds;
import com.modelmonitor.exception.ThresholdConfigurationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the thresholds every cycle evaluates against.
 *
 * <p>The configured thresholds are validated on construction, so a missing or invalid limit
 * stops the application at startup instead of silently passing checks later.
 *
 * <p>When {@code model-monitor.thresholds-file} is set, {@link #reloadIfChanged()} re-reads it
 * between cycles. File entries replace the configured thresholds of the models they name. An
 * invalid file is logged and ignored; the last good set stays active.
 *
 * <p>File format (keys are model keys or identity names, properties kebab-case):
 * <pre>
 * price_prediction:
 *   min-samples: 1000
 *   max-drift-psi: 0.1
 *   max-mape-percent: 12
 *   min-directional-accuracy-percent: 60
 * </pre>
 */
@Component
public class ThresholdsProvider {

    private static final Logger log = LoggerFactory.getLogger(ThresholdsProvider.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final MonitoringProperties monitoringProperties;
    private final Validator validator;

    private final AtomicReference<Map<ModelIdentity, ModelThresholds>> current = new AtomicReference<>();
    private volatile long loadedFileModifiedAt = -1L;

    public ThresholdsProvider(MonitoringProperties monitoringProperties, Validator validator) {
        this.monitoringProperties = monitoringProperties;
        this.validator = validator;

        Map<ModelIdentity, ModelThresholds> configured = new EnumMap<>(ModelIdentity.class);
        configured.putAll(monitoringProperties.getThresholds());
        validate(configured);
        current.set(Collections.unmodifiableMap(configured));
        log.info("Thresholds loaded for models {}", configured.keySet());

        reloadIfChanged();
    }

    /** Immutable thresholds for every registered model. Take one snapshot per cycle. */
    public Map<ModelIdentity, ModelThresholds> snapshot() {
        return current.get();
    }

    public ModelThresholds forModel(ModelIdentity modelIdentity) {
        ModelThresholds thresholds = current.get().get(modelIdentity);
        if (thresholds == null) {
            throw new ThresholdConfigurationException(List.of("no thresholds for " + modelIdentity.getKey()));
        }
        return thresholds;
    }

    /**
     * Re-reads the thresholds file if it changed since the last load.
     *
     * @return true if a new threshold set became active
     */
    public boolean reloadIfChanged() {
        String thresholdsFile = monitoringProperties.getThresholdsFile();
        if (thresholdsFile == null || thresholdsFile.isBlank()) {
            return false;
        }

        Path path = Path.of(thresholdsFile);
        if (!Files.isRegularFile(path)) {
            log.warn("Thresholds file {} not found, keeping current thresholds", path);
            return false;
        }

        try {
            long modifiedAt = Files.getLastModifiedTime(path).toMillis();
            if (modifiedAt == loadedFileModifiedAt) {
                return false;
            }

            Map<ModelIdentity, ModelThresholds> merged = new EnumMap<>(ModelIdentity.class);
            merged.putAll(current.get());
            merged.putAll(readFile(path));
            validate(merged);

            current.set(Collections.unmodifiableMap(merged));
            loadedFileModifiedAt = modifiedAt;
            log.info("Thresholds reloaded from {}", path);
            return true;

        } catch (IOException | IllegalArgumentException | ThresholdConfigurationException e) {
            log.error("Rejected thresholds file {}, keeping current thresholds: {}", path, e.getMessage());
            return false;
        }
    }

    private Map<ModelIdentity, ModelThresholds> readFile(Path path) throws IOException {
        Map<String, ModelThresholds> raw =
                YAML_MAPPER.readValue(path.toFile(), new TypeReference<Map<String, ModelThresholds>>() {});
        Map<ModelIdentity, ModelThresholds> parsed = new EnumMap<>(ModelIdentity.class);
        if (raw != null) {
            raw.forEach((key, thresholds) -> parsed.put(resolveIdentity(key), thresholds));
        }
        return parsed;
    }

    private ModelIdentity resolveIdentity(String key) {
        String normalized = key.trim().toUpperCase().replace('-', '_');
        for (ModelIdentity identity : ModelIdentity.values()) {
            if (identity.name().equals(normalized) || identity.getKey().equalsIgnoreCase(key.trim())) {
                return identity;
            }
        }
        throw new IllegalArgumentException("Unknown model in thresholds file: " + key);
    }

    private void validate(Map<ModelIdentity, ModelThresholds> thresholds) {
        List<String> violations = new ArrayList<>();

        for (ModelIdentity identity : monitoringProperties.getModels()) {
            ModelThresholds modelThresholds = thresholds.get(identity);
            if (modelThresholds == null) {
                violations.add(identity.getKey() + ": no thresholds configured");
                continue;
            }

            Set<ConstraintViolation<ModelThresholds>> constraintViolations = validator.validate(modelThresholds);
            for (ConstraintViolation<ModelThresholds> violation : constraintViolations) {
                violations.add(identity.getKey() + "." + violation.getPropertyPath() + " " + violation.getMessage());
            }

            for (String missing : modelThresholds.missingRequiredLimits(identity.getFamily())) {
                violations.add(identity.getKey() + "." + missing + " is required");
            }
        }

        if (!violations.isEmpty()) {
            throw new ThresholdConfigurationException(violations);
        }
    }
}
