package com.tradeingest.mapper;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.model.NormalizedOrder;
import com.tradeingest.entity.OrderEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from NormalizedOrder to OrderEntity.
 *
 * <p>The owning user, batch and broker come from the import context rather than the row. The entity
 * id, creation time and the duplicate-guard timestamp are set by the caller.
 */
@Mapper
public interface OrderMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(target = "resolvedExecutionTime", ignore = true)
    @Mapping(source = "userId", target = "userId")
    @Mapping(source = "importBatchId", target = "importBatchId")
    @Mapping(source = "brokerType", target = "brokerType")
    @Mapping(source = "order.tags", target = "tags", qualifiedByName = "tagsToText")
    @Mapping(source = "order.brokerMetadata", target = "brokerMetadata", qualifiedByName = "metadataToJson")
    OrderEntity toEntity(NormalizedOrder order, String userId, String importBatchId, BrokerType brokerType);

    @Named("tagsToText")
    default String tagsToText(List<String> tags) {
        return tags == null || tags.isEmpty() ? null : String.join(",", tags);
    }

    @Named("metadataToJson")
    default String metadataToJson(Map<String, String> metadata) {
        return metadata == null || metadata.isEmpty() ? null : JsonHelper.toJson(metadata);
    }
}
