package com.tradeingest.domain.model;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;

/**
 * Best-scoring registry candidate for an upload.
 *
 * <p>The candidate and its confidence are always reported so the decision policy can apply its own
 * tiers; {@code matched} is true only when the confidence clears the detector's acceptance threshold.
 * The reasoning trail is user-facing diagnostics, not an error.
 */
@Getter
@Builder
public class FormatDetectionResult {

    private final BrokerFormat candidate;
    private final double confidence;
    private final boolean matched;
    private final List<String> reasoning;

    public Optional<BrokerFormat> getMatchedFormat() {
        return matched ? Optional.ofNullable(candidate) : Optional.empty();
    }

    public static FormatDetectionResult none(List<String> reasoning) {
        return FormatDetectionResult.builder()
                .confidence(0.0)
                .matched(false)
                .reasoning(reasoning)
                .build();
    }
}
