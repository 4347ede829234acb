package com.tradeingest.unit.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeingest.ai.HeuristicMappingAdapter;
import com.tradeingest.domain.model.MappingProposal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for the keyword and sample-value heuristic adapter. */
class HeuristicMappingAdapterTest {

    private final HeuristicMappingAdapter adapter = new HeuristicMappingAdapter();

    @Test
    @DisplayName("Recognisable headers with consistent values map with full confidence")
    void mapsRecognisableHeaders() {
        List<String> headers = List.of("Date", "Symbol", "Buy/Sell", "Quantity", "T. Price", "Comm/Fee");
        List<Map<String, String>> rows = List.of(
                Map.of("Date", "01/15/2024", "Symbol", "AAPL", "Buy/Sell", "BOT",
                        "Quantity", "100", "T. Price", "185.20", "Comm/Fee", "-1.00"),
                Map.of("Date", "01/16/2024", "Symbol", "MSFT", "Buy/Sell", "SLD",
                        "Quantity", "50", "T. Price", "402.10", "Comm/Fee", "-0.50"));

        MappingProposal proposal = adapter.proposeMapping(headers, rows, null);

        assertThat(proposal.getMappings().get("Date").getField()).isEqualTo("date");
        assertThat(proposal.getMappings().get("Symbol").getField()).isEqualTo("symbol");
        assertThat(proposal.getMappings().get("Buy/Sell").getField()).isEqualTo("side");
        assertThat(proposal.getMappings().get("Quantity").getField()).isEqualTo("quantity");
        assertThat(proposal.getMappings().get("T. Price").getField()).isEqualTo("price");
        assertThat(proposal.getMappings().get("Comm/Fee").getField()).isEqualTo("commission");
        assertThat(proposal.getOverallConfidence()).isEqualTo(1.0);
        assertThat(proposal.getUnmappedFields()).isEmpty();
    }

    @Test
    @DisplayName("Unrecognisable headers all land in brokerMetadata with zero overall confidence")
    void unknownHeadersGoToMetadata() {
        List<String> headers = List.of("foo", "bar", "baz");
        List<Map<String, String>> rows = List.of(Map.of("foo", "1", "bar", "x", "baz", "y"));

        MappingProposal proposal = adapter.proposeMapping(headers, rows, "Mystery Broker");

        assertThat(proposal.getMappings().values())
                .allSatisfy(p -> assertThat(p.getField()).isEqualTo("brokerMetadata"));
        assertThat(proposal.getOverallConfidence()).isZero();
        assertThat(proposal.getUnmappedFields())
                .containsExactly("symbol", "side", "orderQuantity", "orderExecutedTime");
    }

    @Test
    @DisplayName("A keyword match is dropped when sample values do not fit the field")
    void valueCheckGatesKeywordMatch() {
        List<String> headers = List.of("Quantity");
        List<Map<String, String>> rows = List.of(Map.of("Quantity", "lots"), Map.of("Quantity", "few"));

        MappingProposal proposal = adapter.proposeMapping(headers, rows, null);

        assertThat(proposal.getMappings().get("Quantity").getField()).isEqualTo("brokerMetadata");
    }

    @Test
    @DisplayName("Each canonical field is assigned at most once")
    void fieldAssignedOnce() {
        List<String> headers = List.of("Symbol", "Ticker");
        List<Map<String, String>> rows = List.of(Map.of("Symbol", "AAPL", "Ticker", "AAPL"));

        MappingProposal proposal = adapter.proposeMapping(headers, rows, null);

        assertThat(proposal.getMappings().get("Symbol").getField()).isEqualTo("symbol");
        assertThat(proposal.getMappings().get("Ticker").getField()).isEqualTo("brokerMetadata");
    }
}
