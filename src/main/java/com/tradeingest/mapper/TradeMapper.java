package com.tradeingest.mapper;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.model.NormalizedTrade;
import com.tradeingest.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from NormalizedTrade to TradeEntity.
 */
@Mapper
public interface TradeMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(source = "userId", target = "userId")
    @Mapping(source = "importBatchId", target = "importBatchId")
    @Mapping(source = "brokerType", target = "brokerType")
    @Mapping(source = "trade.tags", target = "tags", qualifiedByName = "tradeTagsToText")
    TradeEntity toEntity(NormalizedTrade trade, String userId, String importBatchId, BrokerType brokerType);

    @Named("tradeTagsToText")
    default String tradeTagsToText(List<String> tags) {
        return tags == null || tags.isEmpty() ? null : String.join(",", tags);
    }
}
