package com.tradeingest.unit.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.ColumnMapping;
import com.tradeingest.format.FormatFactory;
import com.tradeingest.format.LearnedFormatMatcher;
import com.tradeingest.support.InMemoryFormatRepository;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for LearnedFormatMatcher similarity against formats learned from earlier uploads. */
class LearnedFormatMatcherTest {

    private InMemoryFormatRepository repository;
    private LearnedFormatMatcher matcher;
    private BrokerFormat learned;

    @BeforeEach
    void setUp() {
        repository = new InMemoryFormatRepository();
        learned = repository.add(FormatFactory.fromMapping(
                "Acme Format 1",
                "Acme",
                List.of(
                        mapping("Ticker", "symbol"),
                        mapping("Direction", "side"),
                        mapping("Units", "quantity"),
                        mapping("Filled At", "orderExecutedTime")),
                List.of(),
                1.0,
                "user-1"));
        matcher = new LearnedFormatMatcher(repository);
    }

    @Test
    @DisplayName("Same columns in another order and case match with score 1.0")
    void identicalFingerprint() {
        Optional<LearnedFormatMatcher.LearnedMatch> match =
                matcher.match(List.of("units", "TICKER", "Filled At", "Direction"));

        assertThat(match).isPresent();
        assertThat(match.get().format().getId()).isEqualTo(learned.getId());
        assertThat(match.get().score()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Jaccard similarity of 0.8 is accepted")
    void similarEnough() {
        Optional<LearnedFormatMatcher.LearnedMatch> match =
                matcher.match(List.of("Ticker", "Direction", "Units", "Filled At", "Venue"));

        assertThat(match).isPresent();
        assertThat(match.get().score()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Similarity below 0.7 is not a match")
    void tooDifferent() {
        assertThat(matcher.match(List.of("Ticker", "Direction", "Venue"))).isEmpty();
    }

    @Test
    @DisplayName("Seeded formats are never matched as learned formats")
    void ignoresSeeded() {
        InMemoryFormatRepository seededOnly = new InMemoryFormatRepository();

        assertThat(new LearnedFormatMatcher(seededOnly).match(List.of("Date", "Symbol", "Buy/Sell", "Quantity")))
                .isEmpty();
    }

    private static ColumnMapping mapping(String column, String field) {
        return ColumnMapping.builder().sourceColumn(column).targetColumn(field).build();
    }
}
