package com.tradeingest.format;

/**
 * Named confidence thresholds shared by the detector, the decision policy and the learned-format
 * matcher. A score meets a tier when it is at or above the threshold, with a small tolerance for
 * floating-point sums that land a hair below an exact boundary.
 */
public enum ConfidenceTier {
    HIGH(0.8),
    ACCEPT(0.7),
    MEDIUM(0.6);

    private static final double EPSILON = 1e-9;

    private final double threshold;

    ConfidenceTier(double threshold) {
        this.threshold = threshold;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isMetBy(double confidence) {
        return confidence + EPSILON >= threshold;
    }
}
