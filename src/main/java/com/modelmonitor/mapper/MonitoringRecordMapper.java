package com.modelmonitor.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.modelmonitor.domain.enums.ModelIdentity;
import com.modelmonitor.domain.model.MonitoringRecord;
import com.modelmonitor.domain.model.MonitoringResult;
import com.modelmonitor.entity.MonitoringRecordEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between MonitoringRecord and MonitoringRecordEntity.
 *
 * <p>The per-model results are a Map in the domain model but stored as a JSON string
 * in the entity. This mapper handles the JSON conversion via {@link JsonHelper}.
 */
@Mapper
public interface MonitoringRecordMapper {

    @Mapping(source = "results", target = "results", qualifiedByName = "resultsToJson")
    MonitoringRecordEntity toEntity(MonitoringRecord monitoringRecord);

    @Mapping(source = "results", target = "results", qualifiedByName = "jsonToResults")
    MonitoringRecord toDomain(MonitoringRecordEntity entity);

    List<MonitoringRecord> toDomainList(List<MonitoringRecordEntity> entities);

    @Named("resultsToJson")
    default String resultsToJson(Map<ModelIdentity, MonitoringResult> results) {
        return JsonHelper.toJson(results);
    }

    @Named("jsonToResults")
    default Map<ModelIdentity, MonitoringResult> jsonToResults(String json) {
        Map<ModelIdentity, MonitoringResult> results =
                JsonHelper.fromJson(json, new TypeReference<Map<ModelIdentity, MonitoringResult>>() {});
        return results != null ? results : Map.of();
    }
}
