package com.tradeingest.mapper;

import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.ImportBatch;
import com.tradeingest.entity.ImportBatchEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between ImportBatch and ImportBatchEntity.
 * The error list and the column-mapping snapshot are JSON text columns.
 */
@Mapper
public interface ImportBatchMapper {

    @Mapping(source = "errors", target = "errors", qualifiedByName = "errorsToJson")
    @Mapping(source = "columnMappings", target = "columnMappings", qualifiedByName = "columnMappingsToJson")
    ImportBatchEntity toEntity(ImportBatch batch);

    @Mapping(source = "errors", target = "errors", qualifiedByName = "jsonToErrors")
    @Mapping(source = "columnMappings", target = "columnMappings", qualifiedByName = "jsonToColumnMappings")
    ImportBatch toDomain(ImportBatchEntity entity);

    List<ImportBatch> toDomainList(List<ImportBatchEntity> entities);

    @Named("errorsToJson")
    default String errorsToJson(List<String> errors) {
        return JsonHelper.toJson(errors);
    }

    @Named("jsonToErrors")
    default List<String> jsonToErrors(String json) {
        return JsonHelper.fromJsonList(json, String.class);
    }

    @Named("columnMappingsToJson")
    default String columnMappingsToJson(List<ColumnMapping> mappings) {
        return mappings == null || mappings.isEmpty() ? null : JsonHelper.toJson(mappings);
    }

    @Named("jsonToColumnMappings")
    default List<ColumnMapping> jsonToColumnMappings(String json) {
        return JsonHelper.fromJsonList(json, ColumnMapping.class);
    }
}
