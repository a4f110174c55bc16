package com.modelmonitor.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the model_predictions table.
 *
 * <p>Written by the serving layer for every prediction; the outcome columns are filled in
 * once the real value is known. Read-only for this service.
 */
@Entity
@Table(
        name = "model_predictions",
        indexes = @Index(name = "idx_predictions_model_created", columnList = "model_name, created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", nullable = false, length = 50)
    private String modelName;

    @Column(name = "predicted_value", nullable = false)
    private double predictedValue;

    /** Null until the outcome is recorded. */
    @Column(name = "actual_value")
    private Double actualValue;

    /** Feature vector the prediction was made from, as a JSON object. */
    @Column(name = "features", columnDefinition = "TEXT")
    private String features;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "rank_position")
    private Integer rankPosition;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
