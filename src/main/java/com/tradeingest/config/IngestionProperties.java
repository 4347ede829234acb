package com.tradeingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Size tiers and review policy for CSV ingestion.
 *
 * <pre>
 * tradeingest.ingestion.inline-limit-bytes=5242880
 * tradeingest.ingestion.background-limit-bytes=52428800
 * tradeingest.ingestion.max-file-bytes=104857600
 * tradeingest.ingestion.sample-row-count=5
 * tradeingest.ingestion.always-require-review-for-ai-mappings=true
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "tradeingest.ingestion")
public class IngestionProperties {

    private long inlineLimitBytes = 5L * 1024 * 1024;
    private long backgroundLimitBytes = 50L * 1024 * 1024;
    private long maxFileBytes = 100L * 1024 * 1024;
    private int sampleRowCount = 5;

    /** AI-proposed mappings are never persisted without a human confirming them. */
    private boolean alwaysRequireReviewForAiMappings = true;
}
