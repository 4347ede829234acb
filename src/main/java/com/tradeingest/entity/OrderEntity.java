package com.tradeingest.entity;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.enums.OrderStatus;
import com.tradeingest.domain.enums.OrderType;
import com.tradeingest.domain.enums.TimeInForce;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the orders table.
 * Every imported order belongs to exactly one import batch. resolved_execution_time is the
 * timestamp the duplicate guard keys on (executed, else placed, else cancelled).
 */
@Entity
@Table(
        name = "orders",
        indexes = @Index(
                name = "idx_orders_duplicate_key",
                columnList = "user_id, symbol, broker_type, resolved_execution_time"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "user_id", length = 100)
    private String userId;

    @Column(name = "import_batch_id", length = 36)
    private String importBatchId;

    @Enumerated(EnumType.STRING)
    @Column(name = "broker_type", columnDefinition = "varchar(30)")
    private BrokerType brokerType;

    @Column(name = "order_id", length = 100)
    private String orderId;

    @Column(name = "parent_order_id", length = 100)
    private String parentOrderId;

    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", columnDefinition = "varchar(20)")
    private OrderType orderType;

    @Enumerated(EnumType.STRING)
    @Column(name = "time_in_force", columnDefinition = "varchar(10)")
    private TimeInForce timeInForce;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_status", columnDefinition = "varchar(20)")
    private OrderStatus orderStatus;

    @Column(name = "order_quantity", precision = 18, scale = 4)
    private BigDecimal orderQuantity;

    @Column(name = "limit_price", precision = 15, scale = 2)
    private BigDecimal limitPrice;

    @Column(name = "stop_price", precision = 15, scale = 2)
    private BigDecimal stopPrice;

    @Column(name = "fill_price", precision = 15, scale = 2)
    private BigDecimal fillPrice;

    @Column(precision = 10, scale = 2)
    private BigDecimal commission;

    @Column(precision = 10, scale = 2)
    private BigDecimal fees;

    @Column(name = "order_placed_time")
    private LocalDateTime orderPlacedTime;

    @Column(name = "order_executed_time")
    private LocalDateTime orderExecutedTime;

    @Column(name = "order_cancelled_time")
    private LocalDateTime orderCancelledTime;

    @Column(name = "resolved_execution_time")
    private LocalDateTime resolvedExecutionTime;

    @Column(name = "account_id", length = 100)
    private String accountId;

    @Column(name = "order_account", length = 100)
    private String orderAccount;

    @Column(name = "order_route", length = 50)
    private String orderRoute;

    @Column(name = "asset_class", length = 50)
    private String assetClass;

    @Column(name = "position_effect", length = 20)
    private String positionEffect;

    @Column(name = "expiration_date", length = 20)
    private String expirationDate;

    @Column(name = "strike_price", precision = 15, scale = 2)
    private BigDecimal strikePrice;

    @Column(name = "option_type", length = 10)
    private String optionType;

    @Column(name = "order_notes", columnDefinition = "TEXT")
    private String orderNotes;

    /** Comma-joined tags. */
    @Column(columnDefinition = "TEXT")
    private String tags;

    /** JSON object of source columns with no canonical field. */
    @Column(name = "broker_metadata", columnDefinition = "TEXT")
    private String brokerMetadata;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
