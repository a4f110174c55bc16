package com.modelmonitor.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.modelmonitor.domain.model.Observation;
import com.modelmonitor.entity.PredictionLogEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from logged predictions to domain observations.
 * The feature vector is stored as a JSON object and decoded via {@link JsonHelper}.
 */
@Mapper
public interface ObservationMapper {

    @Mapping(source = "predictedValue", target = "predicted")
    @Mapping(source = "actualValue", target = "actual")
    @Mapping(source = "features", target = "features", qualifiedByName = "jsonToFeatures")
    @Mapping(source = "createdAt", target = "timestamp")
    @Mapping(source = "rankPosition", target = "rank")
    Observation toDomain(PredictionLogEntity entity);

    List<Observation> toDomainList(List<PredictionLogEntity> entities);

    @Named("jsonToFeatures")
    default Map<String, Double> jsonToFeatures(String json) {
        Map<String, Double> features = JsonHelper.fromJson(json, new TypeReference<Map<String, Double>>() {});
        return features != null ? features : Map.of();
    }
}
