package com.tradeingest.repository.jpa;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.entity.TradeEntity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    @Query("SELECT CASE WHEN COUNT(t) > 0 THEN true ELSE false END FROM TradeEntity t"
            + " WHERE t.userId = :userId AND t.symbol = :symbol"
            + " AND t.quantity = :quantity AND t.executedTime = :executedAt AND t.brokerType = :brokerType")
    boolean existsDuplicate(
            @Param("userId") String userId,
            @Param("symbol") String symbol,
            @Param("quantity") BigDecimal quantity,
            @Param("executedAt") LocalDateTime executedAt,
            @Param("brokerType") BrokerType brokerType);

    List<TradeEntity> findByImportBatchId(String importBatchId);
}
