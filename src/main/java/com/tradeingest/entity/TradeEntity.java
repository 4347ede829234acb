package com.tradeingest.entity;

import com.tradeingest.domain.enums.BrokerType;
import com.tradeingest.domain.enums.TradeSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 * Rows imported through the canonical upload layout.
 */
@Entity
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

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

    @Column(name = "trade_date")
    private LocalDate date;

    @Column(name = "trade_time", length = 20)
    private String time;

    @Column(name = "executed_time")
    private LocalDateTime executedTime;

    @Column(length = 50)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private TradeSide side;

    @Column(precision = 18, scale = 4)
    private BigDecimal quantity;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Column(precision = 10, scale = 2)
    private BigDecimal commission;

    @Column(precision = 10, scale = 2)
    private BigDecimal fees;

    @Column(length = 100)
    private String account;

    @Column(columnDefinition = "TEXT")
    private String notes;

    /** Comma-joined tags. */
    @Column(columnDefinition = "TEXT")
    private String tags;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
