package com.tradeingest.domain.model;

import com.tradeingest.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Canonical trade row produced by the standard-schema path. */
@Data
@Builder
public class NormalizedTrade {

    private LocalDate date;
    private String time;
    private LocalDateTime executedTime;
    private String symbol;
    private TradeSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal commission;
    private BigDecimal fees;
    private String account;
    private String notes;

    @Builder.Default
    private List<String> tags = new ArrayList<>();
}
