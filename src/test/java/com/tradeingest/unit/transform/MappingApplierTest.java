package com.tradeingest.unit.transform;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeingest.domain.enums.FieldDataType;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.transform.MappedRow;
import com.tradeingest.transform.MappingApplier;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for MappingApplier: conflict resolution, transformers and type coercion. */
class MappingApplierTest {

    private MappingApplier applier;

    @BeforeEach
    void setUp() {
        applier = new MappingApplier();
    }

    @Nested
    @DisplayName("First match wins")
    class FirstMatchWins {

        private final Map<String, String> row = Map.of("Qty", "10", "Filled Qty", "7", "Symbol", "AAPL");

        @Test
        @DisplayName("Higher priority wins regardless of list order")
        void priorityWins() {
            List<ColumnMapping> mappings = new ArrayList<>(List.of(
                    mapping("Qty", "quantity", 0.99, 0, FieldDataType.NUMBER),
                    mapping("Filled Qty", "quantity", 0.5, 2, FieldDataType.NUMBER)));

            MappedRow forward = applier.apply(row, mappings);
            Collections.reverse(mappings);
            MappedRow reversed = applier.apply(row, mappings);

            assertThat(forward.getNumber("quantity")).isEqualTo(reversed.getNumber("quantity"));
            assertThat(forward.getNumber("quantity")).contains(new BigDecimal("7"));
            assertThat(forward.getSourceColumn("quantity")).contains("Filled Qty");
            assertThat(forward.getDiagnostics())
                    .containsExactly("Skipped Qty -> quantity: already filled from Filled Qty");
        }

        @Test
        @DisplayName("Equal priority falls back to confidence, then source column name")
        void confidenceThenName() {
            MappedRow byConfidence = applier.apply(row, List.of(
                    mapping("Qty", "quantity", 0.6, 0, FieldDataType.NUMBER),
                    mapping("Filled Qty", "quantity", 0.9, 0, FieldDataType.NUMBER)));
            MappedRow byName = applier.apply(row, List.of(
                    mapping("Qty", "quantity", 0.9, 0, FieldDataType.NUMBER),
                    mapping("Filled Qty", "quantity", 0.9, 0, FieldDataType.NUMBER)));

            assertThat(byConfidence.getSourceColumn("quantity")).contains("Filled Qty");
            assertThat(byName.getSourceColumn("quantity")).contains("Filled Qty");
        }
    }

    @Test
    @DisplayName("Named transformer runs before coercion")
    void transformerApplied() {
        MappedRow mapped = applier.apply(
                Map.of("Buy/Sell", "BOT"),
                List.of(ColumnMapping.builder()
                        .sourceColumn("Buy/Sell")
                        .targetColumn("side")
                        .transformer("ibkrSideMapping")
                        .build()));

        assertThat(mapped.getString("side")).contains("BUY");
    }

    @Test
    @DisplayName("Values that do not coerce are skipped with a diagnostic")
    void coercionFailure() {
        MappedRow mapped = applier.apply(
                Map.of("Px", "n/a", "When", "01/15/2024 09:30:00"),
                List.of(
                        mapping("Px", "price", 1.0, 0, FieldDataType.NUMBER),
                        mapping("When", "orderExecutedTime", 1.0, 0, FieldDataType.DATE)));

        assertThat(mapped.getNumber("price")).isEmpty();
        assertThat(mapped.getDiagnostics()).anyMatch(d -> d.contains("is not a valid number"));
        assertThat(mapped.getDateTime("orderExecutedTime")).contains(LocalDateTime.of(2024, 1, 15, 9, 30));
    }

    @Test
    @DisplayName("brokerMetadata targets land in the side channel and currency is stripped from numbers")
    void metadataAndCurrency() {
        MappedRow mapped = applier.apply(
                Map.of("Venue", "ARCA", "Price", "$1,234.50", "SYMBOL", "aapl"),
                List.of(
                        mapping("Venue", "brokerMetadata", 0.5, 0, FieldDataType.STRING),
                        mapping("Price", "price", 1.0, 0, FieldDataType.NUMBER),
                        mapping("Symbol", "symbol", 1.0, 0, FieldDataType.STRING)));

        assertThat(mapped.getBrokerMetadata()).containsEntry("Venue", "ARCA");
        assertThat(mapped.getNumber("price")).contains(new BigDecimal("1234.50"));
        assertThat(mapped.getString("symbol")).contains("aapl");
    }

    private static ColumnMapping mapping(
            String column, String field, double confidence, int priority, FieldDataType type) {
        return ColumnMapping.builder()
                .sourceColumn(column)
                .targetColumn(field)
                .confidence(confidence)
                .priority(priority)
                .dataType(type)
                .build();
    }
}
