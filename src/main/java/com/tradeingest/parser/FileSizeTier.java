package com.tradeingest.parser;

import com.tradeingest.config.IngestionProperties;

/**
 * Size contract for uploads. This service processes INLINE and BACKGROUND files itself only when the
 * caller chooses to; scheduling the larger tiers onto a worker is the caller's concern.
 */
public enum FileSizeTier {
    INLINE,
    BACKGROUND,
    BATCH,
    REJECTED;

    public static FileSizeTier classify(long fileSize, IngestionProperties properties) {
        if (fileSize <= properties.getInlineLimitBytes()) {
            return INLINE;
        }
        if (fileSize <= properties.getBackgroundLimitBytes()) {
            return BACKGROUND;
        }
        if (fileSize <= properties.getMaxFileBytes()) {
            return BATCH;
        }
        return REJECTED;
    }
}
