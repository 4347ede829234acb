package com.tradeingest.mapping;

import com.tradeingest.config.IngestionProperties;
import com.tradeingest.format.ConfidenceTier;
import org.springframework.stereotype.Component;

/**
 * Review gate for AI-proposed mappings. With {@code always-require-review-for-ai-mappings} on (the
 * default) every AI path parks for review regardless of confidence; with it off, only proposals
 * below {@link ConfidenceTier#HIGH} do. Registry and user paths never need review.
 */
@Component
public class ReviewPolicy {

    private final IngestionProperties ingestionProperties;

    public ReviewPolicy(IngestionProperties ingestionProperties) {
        this.ingestionProperties = ingestionProperties;
    }

    public boolean requiresReview(MappingStrategy strategy, double overallConfidence) {
        if (!strategy.isAiAssisted()) {
            return false;
        }
        if (ingestionProperties.isAlwaysRequireReviewForAiMappings()) {
            return true;
        }
        return !ConfidenceTier.HIGH.isMetBy(overallConfidence);
    }

    public boolean requiresBrokerSelection(MappingStrategy strategy) {
        return strategy == MappingStrategy.AI_WITHOUT_HINT;
    }
}
