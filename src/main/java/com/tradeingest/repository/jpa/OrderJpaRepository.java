package com.tradeingest.repository.jpa;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.entity.OrderEntity;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the orders table.
 * The existence query backs the duplicate guard; quantity is compared numerically so 25 and 25.0000 match.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    @Query("SELECT CASE WHEN COUNT(o) > 0 THEN true ELSE false END FROM OrderEntity o"
            + " WHERE o.userId = :userId AND o.symbol = :symbol"
            + " AND o.orderQuantity = :quantity AND o.resolvedExecutionTime = :executedAt"
            + " AND o.brokerType = :brokerType")
    boolean existsDuplicate(
            @Param("userId") String userId,
            @Param("symbol") String symbol,
            @Param("quantity") BigDecimal quantity,
            @Param("executedAt") LocalDateTime executedAt,
            @Param("brokerType") BrokerType brokerType);

    List<OrderEntity> findByImportBatchId(String importBatchId);
}
