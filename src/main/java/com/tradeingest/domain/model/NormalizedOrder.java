package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.enums.OrderStatus;
import com.tradeingest.domain.enums.OrderType;
import com.tradeingest.domain.enums.TimeInForce;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Canonical order row produced by every mapping path except the standard schema. */
@Data
@Builder
public class NormalizedOrder {

    private String orderId;
    private String parentOrderId;
    private String symbol;
    private OrderSide side;
    private OrderType orderType;
    private TimeInForce timeInForce;
    private OrderStatus orderStatus;
    private BigDecimal orderQuantity;
    private BigDecimal limitPrice;
    private BigDecimal stopPrice;
    private BigDecimal fillPrice;
    private BigDecimal commission;
    private BigDecimal fees;
    private LocalDateTime orderPlacedTime;
    private LocalDateTime orderExecutedTime;
    private LocalDateTime orderCancelledTime;
    private String accountId;
    private String orderAccount;
    private String orderRoute;
    private String assetClass;
    private String positionEffect;
    private String expirationDate;
    private BigDecimal strikePrice;
    private String optionType;
    private String orderNotes;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /** Source columns with no canonical home. */
    @Builder.Default
    private Map<String, String> brokerMetadata = new LinkedHashMap<>();
}
