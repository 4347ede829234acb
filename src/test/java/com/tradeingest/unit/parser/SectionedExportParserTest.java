package com.tradeingest.unit.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeingest.TestFixtures;
import com.tradeingest.domain.enums.OrderSection;
import com.tradeingest.domain.enums.OrderSide;
import com.tradeingest.domain.enums.OrderStatus;
import com.tradeingest.domain.enums.OrderType;
import com.tradeingest.domain.model.NormalizedOrder;
import com.tradeingest.domain.model.SectionedExport;
import com.tradeingest.exception.CsvValidationException;
import com.tradeingest.parser.SectionedExportParser;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for SectionedExportParser against a multi-section trade activity export. */
class SectionedExportParserTest {

    private SectionedExportParser parser;

    @BeforeEach
    void setUp() {
        parser = new SectionedExportParser();
    }

    @Test
    @DisplayName("Signature is recognised anywhere in the content")
    void signature() {
        assertThat(SectionedExportParser.matchesSignature(TestFixtures.read(TestFixtures.SCHWAB_EXPORT))).isTrue();
        assertThat(SectionedExportParser.matchesSignature("Date,Symbol\n2024-01-15,AAPL")).isFalse();
    }

    @Test
    @DisplayName("Content without the signature is rejected")
    void rejectsPlainCsv() {
        assertThatThrownBy(() -> parser.parse("Symbol,Side\nAAPL,BUY"))
                .isInstanceOf(CsvValidationException.class);
    }

    @Nested
    @DisplayName("Full export")
    class FullExport {

        private SectionedExport export;

        @BeforeEach
        void parse() {
            export = parser.parse(TestFixtures.read(TestFixtures.SCHWAB_EXPORT));
        }

        @Test
        @DisplayName("Metadata line yields account number and report date")
        void metadata() {
            assertThat(export.getAccountNumber()).isEqualTo("12345678");
            assertThat(export.getReportDate()).isEqualTo(LocalDate.of(2024, 1, 15));
        }

        @Test
        @DisplayName("Each section lands in its own bucket; parsing stops at Rolling Strategies")
        void buckets() {
            assertThat(export.getOrders(OrderSection.WORKING)).hasSize(1);
            assertThat(export.getOrders(OrderSection.FILLED)).hasSize(2);
            assertThat(export.getOrders(OrderSection.CANCELLED)).hasSize(1);
            assertThat(export.getErrors()).isEmpty();
            assertThat(export.getTotalRecords()).isEqualTo(4);
        }

        @Test
        @DisplayName("Cancelled row without a symbol is skipped, not failed")
        void skipsCancelledWithoutSymbol() {
            assertThat(export.getSkippedRows()).isEqualTo(1);
        }

        @Test
        @DisplayName("Working order with '~' price is a market order placed at Time Placed")
        void workingOrder() {
            NormalizedOrder order = export.getOrders(OrderSection.WORKING).get(0);

            assertThat(order.getSymbol()).isEqualTo("MSFT");
            assertThat(order.getOrderType()).isEqualTo(OrderType.MARKET);
            assertThat(order.getLimitPrice()).isNull();
            assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getOrderPlacedTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 9, 31, 2));
            assertThat(order.getOrderExecutedTime()).isNull();
            assertThat(order.getOrderNotes()).isEqualTo("WORKING");
            assertThat(order.getOptionType()).isNull();
        }

        @Test
        @DisplayName("Filled orders use Exec Time for both placed and executed time")
        void filledOrders() {
            NormalizedOrder stock = export.getOrders(OrderSection.FILLED).get(0);
            NormalizedOrder option = export.getOrders(OrderSection.FILLED).get(1);

            assertThat(stock.getOrderExecutedTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 9, 35, 12));
            assertThat(stock.getOrderPlacedTime()).isEqualTo(stock.getOrderExecutedTime());
            assertThat(stock.getOrderType()).isEqualTo(OrderType.LIMIT);
            assertThat(stock.getFillPrice()).isEqualByComparingTo("185.20");
            assertThat(stock.getOrderAccount()).isEqualTo("12345678");

            assertThat(option.getSide()).isEqualTo(OrderSide.SELL);
            assertThat(option.getOrderQuantity()).isEqualByComparingTo(BigDecimal.valueOf(2));
            assertThat(option.getOptionType()).isEqualTo("CALL");
            assertThat(option.getStrikePrice()).isEqualByComparingTo("475");
            assertThat(option.getOrderType()).isEqualTo(OrderType.MARKET);
        }

        @Test
        @DisplayName("Cancelled orders carry the cancel time as placed and cancelled time")
        void cancelledOrder() {
            NormalizedOrder order = export.getOrders(OrderSection.CANCELLED).get(0);

            assertThat(order.getSymbol()).isEqualTo("TSLA");
            assertThat(order.getOrderStatus()).isEqualTo(OrderStatus.CANCELLED);
            assertThat(order.getOrderCancelledTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 11, 0));
            assertThat(order.getOrderPlacedTime()).isEqualTo(order.getOrderCancelledTime());
            assertThat(order.getLimitPrice()).isEqualByComparingTo("250.00");
        }
    }

    @Test
    @DisplayName("Bad rows become section-qualified errors; a missing time falls back to the report date")
    void rowErrors() {
        String content = "Today's Trade Activity for 999 (Margin) on 3/4/24 08:00:00\n"
                + "Filled Orders\n"
                + ",,Exec Time,Spread,Side,Qty,Symbol,Price\n"
                + ",,,STOCK,BUY,10,AMD,150\n"
                + ",,3/4/24 10:00:00,STOCK,HOLD,10,AMD,150\n"
                + ",,3/4/24 10:01:00,STOCK,BUY,0,AMD,150\n";

        SectionedExport export = parser.parse(content);

        assertThat(export.getOrders(OrderSection.FILLED)).hasSize(1);
        assertThat(export.getOrders(OrderSection.FILLED).get(0).getOrderExecutedTime())
                .isEqualTo(LocalDateTime.of(2024, 3, 4, 0, 0));
        assertThat(export.getErrors())
                .containsExactly(
                        "Filled Orders row 2: Unrecognized side 'HOLD'",
                        "Filled Orders row 3: Invalid quantity '0'");
    }
}
