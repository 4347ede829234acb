package com.tradeingest.unit.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.enums.OrderStatus;
import com.tradeingest.domain.enums.OrderType;
import com.tradeingest.domain.enums.TimeInForce;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.domain.model.NormalizedOrder;
import com.tradeingest.transform.ExecutionTimeResolver;
import com.tradeingest.transform.MappedRow;
import com.tradeingest.transform.MappingApplier;
import com.tradeingest.transform.OrderNormalizer;
import com.tradeingest.transform.RowRejectedException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for OrderNormalizer: required fields, defaults, tags and metadata. */
class OrderNormalizerTest {

    private static final List<ColumnMapping> MAPPINGS = List.of(
            mapping("Symbol", "symbol", FieldDataType.STRING, null),
            mapping("Buy/Sell", "side", FieldDataType.STRING, "ibkrSideMapping"),
            mapping("Quantity", "quantity", FieldDataType.NUMBER, null),
            mapping("T. Price", "price", FieldDataType.NUMBER, null),
            mapping("Comm/Fee", "commission", FieldDataType.NUMBER, null),
            mapping("Date/Time", "orderExecutedTime", FieldDataType.DATE, null),
            mapping("Exchange", "brokerMetadata", FieldDataType.STRING, null));

    private MappingApplier applier;
    private OrderNormalizer normalizer;

    @BeforeEach
    void setUp() {
        applier = new MappingApplier();
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        normalizer = new OrderNormalizer(new ExecutionTimeResolver(clock));
    }

    @Test
    @DisplayName("Builds an order with defaults, tags and broker metadata")
    void normalizesCompleteRow() {
        NormalizedOrder order = normalizer.normalize(
                applier.apply(fullRow(), MAPPINGS), List.of("ira", "swing"));

        assertThat(order.getSymbol()).isEqualTo("AAPL");
        assertThat(order.getSide()).isEqualTo(OrderSide.SELL);
        assertThat(order.getOrderQuantity()).isEqualByComparingTo("100");
        assertThat(order.getLimitPrice()).isEqualByComparingTo("185.2");
        assertThat(order.getCommission()).isEqualByComparingTo("-1.00");
        assertThat(order.getOrderType()).isEqualTo(OrderType.MARKET);
        assertThat(order.getTimeInForce()).isEqualTo(TimeInForce.DAY);
        assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(order.getOrderExecutedTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 9, 35, 12));
        assertThat(order.getTags()).containsExactly("ira", "swing");
        assertThat(order.getBrokerMetadata()).containsEntry("Exchange", "NASDAQ");
    }

    @Test
    @DisplayName("Negative quantities are stored as their absolute value")
    void absoluteQuantity() {
        Map<String, String> row = fullRow();
        row.put("Quantity", "-25");

        NormalizedOrder order = normalizer.normalize(applier.apply(row, MAPPINGS), List.of());

        assertThat(order.getOrderQuantity()).isEqualTo(new BigDecimal("25"));
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Missing symbol")
        void missingSymbol() {
            Map<String, String> row = fullRow();
            row.put("Symbol", "");
            assertRejected(row, "Missing symbol");
        }

        @Test
        @DisplayName("Missing side")
        void missingSide() {
            Map<String, String> row = fullRow();
            row.remove("Buy/Sell");
            assertRejected(row, "Missing side");
        }

        @Test
        @DisplayName("Unrecognized side")
        void unknownSide() {
            Map<String, String> row = fullRow();
            row.put("Buy/Sell", "HOLD");
            assertRejected(row, "Unrecognized side 'HOLD'");
        }

        @Test
        @DisplayName("Zero quantity")
        void zeroQuantity() {
            Map<String, String> row = fullRow();
            row.put("Quantity", "0");
            assertRejected(row, "Missing or non-positive quantity");
        }

        private void assertRejected(Map<String, String> row, String message) {
            MappedRow mapped = applier.apply(row, MAPPINGS);
            assertThatThrownBy(() -> normalizer.normalize(mapped, List.of()))
                    .isInstanceOf(RowRejectedException.class)
                    .hasMessage(message);
        }
    }

    private static Map<String, String> fullRow() {
        Map<String, String> row = new HashMap<>();
        row.put("Symbol", "aapl");
        row.put("Buy/Sell", "SLD");
        row.put("Quantity", "100");
        row.put("T. Price", "185.20");
        row.put("Comm/Fee", "-1.00");
        row.put("Date/Time", "2024-01-15 09:35:12");
        row.put("Exchange", "NASDAQ");
        return row;
    }

    private static ColumnMapping mapping(String column, String field, FieldDataType type, String transformer) {
        return ColumnMapping.builder()
                .sourceColumn(column)
                .targetColumn(field)
                .confidence(1.0)
                .dataType(type)
                .transformer(transformer)
                .build();
    }
}
