package com.tradeingest.unit.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import com.tradeingest.domain.model.BrokerFormat;
import com.tradeingest.domain.model.DetectionPatterns;
import com.tradeingest.domain.model.FieldMapping;
import com.tradeingest.domain.model.FormatDetectionResult;
import com.tradeingest.format.FormatDetector;
import com.tradeingest.format.SeededFormats;
import com.tradeingest.support.InMemoryFormatRepository;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for FormatDetector scoring against seeded and hand-built formats. */
class FormatDetectorTest {

    private static final List<String> IBKR_HEADERS =
            List.of("Date", "Symbol", "Buy/Sell", "Quantity", "T. Price", "Comm/Fee");

    private static final List<Map<String, String>> IBKR_ROWS = List.of(
            row("2024-01-15", "AAPL", "BOT", "100", "185.50", "-1.00"),
            row("2024-01-15", "MSFT", "SLD", "50", "390.25", "-1.00"),
            row("2024-01-16", "NVDA", "BOT", "10", "550.00", "-0.35"));

    private FormatDetector detector;

    @BeforeEach
    void setUp() {
        detector = new FormatDetector(new InMemoryFormatRepository());
    }

    @Nested
    @DisplayName("Seeded formats")
    class Seeded {

        @Test
        @DisplayName("IBKR headers with matching values score at least 0.95 and match")
        void ibkrMatches() {
            FormatDetectionResult result = detector.detect(IBKR_HEADERS, IBKR_ROWS, null);

            assertThat(result.isMatched()).isTrue();
            assertThat(result.getCandidate().getId()).isEqualTo(SeededFormats.IBKR_FLEX);
            assertThat(result.getConfidence()).isGreaterThanOrEqualTo(0.95);
            assertThat(result.getReasoning()).last().asString().startsWith("Matched Interactive Brokers");
        }

        @Test
        @DisplayName("Detection is deterministic for the same input")
        void deterministic() {
            FormatDetectionResult first = detector.detect(IBKR_HEADERS, IBKR_ROWS, null);
            FormatDetectionResult second = detector.detect(IBKR_HEADERS, IBKR_ROWS, null);

            assertThat(second.getCandidate().getId()).isEqualTo(first.getCandidate().getId());
            assertThat(second.getConfidence()).isEqualTo(first.getConfidence());
            assertThat(second.getReasoning()).isEqualTo(first.getReasoning());
        }

        @Test
        @DisplayName("Unknown headers do not match but still report the best candidate")
        void unknownHeaders() {
            FormatDetectionResult result = detector.detect(List.of("foo", "bar", "baz"), List.of(), null);

            assertThat(result.isMatched()).isFalse();
            assertThat(result.getMatchedFormat()).isEmpty();
            assertThat(result.getReasoning()).last().asString().startsWith("No format matched");
        }

        @Test
        @DisplayName("Sectioned format is scored on content: signature plus section markers")
        void sectionedScoring() {
            BrokerFormat schwab = new InMemoryFormatRepository().findById(SeededFormats.SCHWAB_TODAYS_TRADES).get();
            String content = "Today's Trade Activity for 123 (Cash) on 1/2/24 10:00:00\n"
                    + "Working Orders,,,\nFilled Orders\n";

            FormatDetector.FormatScore score = detector.score(schwab, List.of(), List.of(), content);

            assertThat(score.confidence()).isCloseTo(0.8 + 0.2 * 2 / 3, offset(1e-9));
            assertThat(detector.score(schwab, List.of(), List.of(), null).confidence()).isZero();
        }
    }

    @Nested
    @DisplayName("Score boundaries")
    class Boundaries {

        private BrokerFormat twoColumnFormat;

        @BeforeEach
        void build() {
            Map<String, FieldMapping> fields = new LinkedHashMap<>();
            fields.put("Symbol", FieldMapping.builder().targetField("symbol").required(true).build());
            fields.put("Side", FieldMapping.builder().targetField("side").required(true).build());
            twoColumnFormat = BrokerFormat.builder()
                    .id("two-column")
                    .name("Two Column")
                    .fieldMappings(fields)
                    .detectionPatterns(DetectionPatterns.builder()
                            .requiredHeaders(List.of("Symbol", "Side"))
                            .valuePatterns(Map.of("Side", "^(BUY|SELL)$"))
                            .build())
                    .build();
            detector = new FormatDetector(new InMemoryFormatRepository(List.of(twoColumnFormat)));
        }

        @Test
        @DisplayName("All headers but no pattern hits lands exactly on 0.70 and is accepted")
        void exactlyAcceptThreshold() {
            List<Map<String, String>> rows = List.of(Map.of("Symbol", "AAPL", "Side", "HOLD"));

            FormatDetectionResult result = detector.detect(List.of("Symbol", "Side"), rows, null);

            assertThat(result.getConfidence()).isCloseTo(0.70, offset(1e-9));
            assertThat(result.isMatched()).isTrue();
        }

        @Test
        @DisplayName("Pattern term counts only when there are sample rows")
        void noSamplesSkipsPatterns() {
            FormatDetector.FormatScore score =
                    detector.score(twoColumnFormat, List.of("Symbol", "Side"), List.of(), null);

            assertThat(score.confidence()).isCloseTo(1.0, offset(1e-9));
            assertThat(score.reasoning()).contains("patterns n/a");
        }

        @Test
        @DisplayName("More than two headers beyond the mapped columns rejects the format")
        void tooManyExtraHeaders() {
            List<String> headers = List.of("Symbol", "Side", "A", "B", "C");

            FormatDetector.FormatScore score = detector.score(twoColumnFormat, headers, List.of(), null);

            assertThat(score.confidence()).isZero();
            assertThat(score.reasoning()).contains("rejected");
        }

        @Test
        @DisplayName("Two extra headers are tolerated")
        void twoExtraHeadersTolerated() {
            List<String> headers = List.of("Symbol", "Side", "A", "B");

            FormatDetector.FormatScore score = detector.score(twoColumnFormat, headers, List.of(), null);

            assertThat(score.confidence()).isGreaterThan(0.0);
        }

        @Test
        @DisplayName("Required headers match when contained in an uploaded header, ignoring case")
        void containedHeaders() {
            FormatDetector.FormatScore score =
                    detector.score(twoColumnFormat, List.of("symbol code", "SIDE"), List.of(), null);

            assertThat(score.reasoning()).contains("headers 2/2").contains("exact 0/2");
        }
    }

    private static Map<String, String> row(String... values) {
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < IBKR_HEADERS.size(); i++) {
            row.put(IBKR_HEADERS.get(i), values[i]);
        }
        return row;
    }
}
