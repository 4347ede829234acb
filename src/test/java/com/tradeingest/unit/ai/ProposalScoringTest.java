package com.tradeingest.unit.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.tradeingest.ai.ProposalScoring;
import com.tradeingest.domain.model.MappingProposal.ProposedField;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for proposal confidence arithmetic. */
class ProposalScoringTest {

    @Test
    @DisplayName("Critical fields weigh double and metadata is not scored")
    void weightedMean() {
        Map<String, ProposedField> mappings = new LinkedHashMap<>();
        mappings.put("A", new ProposedField("symbol", 0.9));
        mappings.put("B", new ProposedField("side", 0.6));
        mappings.put("C", new ProposedField("price", 0.3));
        mappings.put("D", new ProposedField("brokerMetadata", 0.5));

        assertThat(ProposalScoring.overallConfidence(mappings)).isCloseTo(0.66, within(1e-9));
    }

    @Test
    @DisplayName("Out-of-range confidences are clamped")
    void clamped() {
        Map<String, ProposedField> mappings = Map.of("A", new ProposedField("price", 1.7));

        assertThat(ProposalScoring.overallConfidence(mappings)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Empty or metadata-only proposals score zero")
    void nothingScored() {
        assertThat(ProposalScoring.overallConfidence(Map.of())).isZero();
        assertThat(ProposalScoring.overallConfidence(Map.of("X", new ProposedField("brokerMetadata", 1.0))))
                .isZero();
    }

    @Test
    @DisplayName("A critical group is satisfied by any of its fields")
    void unmappedGroups() {
        List<ProposedField> proposed = List.of(
                new ProposedField("symbol", 1.0),
                new ProposedField("quantity", 1.0),
                new ProposedField("date", 1.0));

        assertThat(ProposalScoring.unmappedCriticalFields(proposed)).containsExactly("side");
    }
}
