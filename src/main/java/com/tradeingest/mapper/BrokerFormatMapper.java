package com.tradeingest.mapper;

import com.fasterxml.jackson.core.type.TypeReference;
import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.DetectionPatterns;
import com.tradeingest.domain.model.FieldMapping;
import com.tradeingest.entity.BrokerFormatEntity;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between BrokerFormat and BrokerFormatEntity.
 *
 * <p>Field mappings and detection patterns are stored as JSON text. Only learned formats are
 * persisted, so {@code seeded} is always false on the way back.
 */
@Mapper
public interface BrokerFormatMapper {

    @Mapping(source = "fieldMappings", target = "fieldMappings", qualifiedByName = "fieldMappingsToJson")
    @Mapping(source = "detectionPatterns", target = "detectionPatterns", qualifiedByName = "patternsToJson")
    BrokerFormatEntity toEntity(BrokerFormat format);

    @Mapping(source = "fieldMappings", target = "fieldMappings", qualifiedByName = "jsonToFieldMappings")
    @Mapping(source = "detectionPatterns", target = "detectionPatterns", qualifiedByName = "jsonToPatterns")
    @Mapping(target = "seeded", constant = "false")
    BrokerFormat toDomain(BrokerFormatEntity entity);

    List<BrokerFormat> toDomainList(List<BrokerFormatEntity> entities);

    @Named("fieldMappingsToJson")
    default String fieldMappingsToJson(Map<String, FieldMapping> fieldMappings) {
        return JsonHelper.toJson(fieldMappings);
    }

    @Named("jsonToFieldMappings")
    default Map<String, FieldMapping> jsonToFieldMappings(String json) {
        Map<String, FieldMapping> mappings =
                JsonHelper.fromJson(json, new TypeReference<LinkedHashMap<String, FieldMapping>>() {});
        return mappings != null ? mappings : new LinkedHashMap<>();
    }

    @Named("patternsToJson")
    default String patternsToJson(DetectionPatterns patterns) {
        return JsonHelper.toJson(patterns);
    }

    @Named("jsonToPatterns")
    default DetectionPatterns jsonToPatterns(String json) {
        DetectionPatterns patterns = JsonHelper.fromJson(json, new TypeReference<DetectionPatterns>() {});
        return patterns != null ? patterns : new DetectionPatterns();
    }
}
