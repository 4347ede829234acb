package com.tradeingest.unit.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradeingest.config.IngestionProperties;
import com.tradeingest.domain.model.ParsedCsv;
import com.tradeingest.exception.CsvValidationException;
import com.tradeingest.parser.FileSizeTier;
import com.tradeingest.parser.RawCsvParser;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for RawCsvParser: header handling, row shaping and size rules. */
class RawCsvParserTest {

    private IngestionProperties properties;
    private RawCsvParser parser;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        parser = new RawCsvParser(properties);
    }

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("Rows are keyed by header and blank lines are skipped")
        void rowsKeyedByHeader() {
            ParsedCsv parsed = parser.parse("Symbol,Side,Qty\nAAPL,BUY,10\n\n,,\nMSFT,SELL,5\n");

            assertThat(parsed.getHeaders()).containsExactly("Symbol", "Side", "Qty");
            assertThat(parsed.getRowCount()).isEqualTo(2);
            assertThat(parsed.getRows().get(1)).containsEntry("Symbol", "MSFT").containsEntry("Qty", "5");
        }

        @Test
        @DisplayName("Byte order mark is stripped from the first header")
        void stripsByteOrderMark() {
            ParsedCsv parsed = parser.parse("\uFEFFDate,Symbol\n2024-01-15,AAPL\n");

            assertThat(parsed.getHeaders()).containsExactly("Date", "Symbol");
        }

        @Test
        @DisplayName("Blank and duplicate headers are dropped; the first non-empty duplicate value wins")
        void blankAndDuplicateHeaders() {
            ParsedCsv parsed = parser.parse("Symbol,,Notes,Notes\nAAPL,x,,second\n");

            assertThat(parsed.getHeaders()).containsExactly("Symbol", "Notes");
            assertThat(parsed.getRows().get(0)).containsEntry("Notes", "second").doesNotContainKey("");
        }

        @Test
        @DisplayName("Short rows are padded with empty values; quoted commas stay in one cell")
        void shortAndQuotedRows() {
            ParsedCsv parsed = parser.parse("Symbol,Notes,Qty\n\"AAPL\",\"split, then filled\"\n");

            assertThat(parsed.getRows().get(0))
                    .containsEntry("Notes", "split, then filled")
                    .containsEntry("Qty", "");
        }

        @Test
        @DisplayName("Sample rows are capped at the configured sample size")
        void sampleRowsCapped() {
            properties.setSampleRowCount(2);
            ParsedCsv parsed = parser.parse("Symbol\nA\nB\nC\n");

            assertThat(parsed.getSampleRows()).hasSize(2);
            assertThat(parsed.getRowCount()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Validation failures")
    class ValidationFailures {

        @Test
        @DisplayName("Empty content is rejected")
        void emptyContent() {
            assertThatThrownBy(() -> parser.parse("  "))
                    .isInstanceOf(CsvValidationException.class)
                    .hasMessage("File is empty");
        }

        @Test
        @DisplayName("Header without data rows is rejected")
        void headerOnly() {
            assertThatThrownBy(() -> parser.parse("Symbol,Side\n"))
                    .isInstanceOf(CsvValidationException.class)
                    .hasMessageContaining("no data rows");
        }

        @Test
        @DisplayName("Unterminated quote is reported as unparsable")
        void unterminatedQuote() {
            assertThatThrownBy(() -> parser.parse("Symbol,Notes\nAAPL,\"open quote\n"))
                    .isInstanceOf(CsvValidationException.class)
                    .hasMessage("Unparsable CSV structure");
        }

        @Test
        @DisplayName("Content above the maximum size is rejected")
        void oversized() {
            properties.setMaxFileBytes(10);

            assertThatThrownBy(() -> parser.checkSize("Symbol,Side\nAAPL,BUY\n"))
                    .isInstanceOf(CsvValidationException.class)
                    .satisfies(e -> assertThat(((CsvValidationException) e).getDefects()).hasSize(1));
        }
    }

    @Nested
    @DisplayName("Size tiers")
    class SizeTiers {

        @Test
        @DisplayName("Tier boundaries are inclusive")
        void boundaries() {
            assertThat(FileSizeTier.classify(properties.getInlineLimitBytes(), properties))
                    .isEqualTo(FileSizeTier.INLINE);
            assertThat(FileSizeTier.classify(properties.getInlineLimitBytes() + 1, properties))
                    .isEqualTo(FileSizeTier.BACKGROUND);
            assertThat(FileSizeTier.classify(properties.getBackgroundLimitBytes() + 1, properties))
                    .isEqualTo(FileSizeTier.BATCH);
            assertThat(FileSizeTier.classify(properties.getMaxFileBytes() + 1, properties))
                    .isEqualTo(FileSizeTier.REJECTED);
        }
    }

    @Test
    @DisplayName("parseLine splits a single delimited line")
    void parseLine() {
        assertThat(RawCsvParser.parseLine("a, b ,\"c,d\"")).isEqualTo(List.of("a", "b", "c,d"));
    }
}
