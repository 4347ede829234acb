package com.tradeingest.ingest;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.model.NormalizedOrder;
import com.tradeingest.domain.model.NormalizedTrade;
import com.tradeingest.repository.jpa.OrderJpaRepository;
import com.tradeingest.repository.jpa.TradeJpaRepository;
import java.time.LocalDateTime;
import org.springframework.stereotype.Component;

/**
 * Checks whether a normalized row was already imported for the same user.
 *
 * <p>The key is user, symbol, quantity, resolved execution time and broker. Every row arrives here with a
 * time: mapped rows lacking one are stamped with the import time by
 * {@link com.tradeingest.transform.ExecutionTimeResolver}, so a file without timestamps is stored again on
 * every upload.
 */
@Component
public class DuplicateGuard {

    private final OrderJpaRepository orderJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;

    public DuplicateGuard(OrderJpaRepository orderJpaRepository, TradeJpaRepository tradeJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
    }

    public boolean isDuplicate(String userId, NormalizedOrder order, BrokerType brokerType) {
        return orderJpaRepository.existsDuplicate(
                userId, order.getSymbol(), order.getOrderQuantity(), resolvedExecutionTime(order), brokerType);
    }

    public boolean isDuplicate(String userId, NormalizedTrade trade, BrokerType brokerType) {
        return tradeJpaRepository.existsDuplicate(
                userId, trade.getSymbol(), trade.getQuantity(), trade.getExecutedTime(), brokerType);
    }

    /** Executed time, else placed time, else cancelled time. */
    public static LocalDateTime resolvedExecutionTime(NormalizedOrder order) {
        if (order.getOrderExecutedTime() != null) {
            return order.getOrderExecutedTime();
        }
        if (order.getOrderPlacedTime() != null) {
            return order.getOrderPlacedTime();
        }
        return order.getOrderCancelledTime();
    }
}
