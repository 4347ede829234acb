package com.tradeingest.unit.format;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradeingest.format.ConfidenceTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Threshold boundaries of the shared confidence tiers. */
class ConfidenceTierTest {

    @ParameterizedTest(name = "{0} meets {1}: {2}")
    @CsvSource({
        "0.80, HIGH, true",
        "0.7999, HIGH, false",
        "0.70, ACCEPT, true",
        "0.699, ACCEPT, false",
        "0.60, MEDIUM, true",
        "0.599, MEDIUM, false"
    })
    void boundaries(double confidence, ConfidenceTier tier, boolean expected) {
        assertThat(tier.isMetBy(confidence)).isEqualTo(expected);
    }

    @Test
    @DisplayName("A floating-point sum a hair below 0.7 still meets ACCEPT")
    void toleratesRoundingBelowBoundary() {
        double sum = 0.7 - 1e-12;

        assertThat(ConfidenceTier.ACCEPT.isMetBy(sum)).isTrue();
        assertThat(ConfidenceTier.ACCEPT.isMetBy(0.6 + 0.09)).isFalse();
    }
}
