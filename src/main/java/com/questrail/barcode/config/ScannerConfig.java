package com.questrail.barcode.config;

/**
 * ScannerConfig
 * -----------------------------------------------------------------------------
 * Tuning parameters of the recognition pipeline.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>threshold</b>: Position of the bar/space pivot between the darkest
 *       and lightest luminance of the scanned row, strictly between 0 and 1.
 *       Lower values classify fewer pixels as bars.</li>
 *   <li><b>candidatesPerGroup</b>: How many digit guesses each four-run group
 *       keeps per reference table (1-10). More guesses let the checksum repair
 *       more misreads but also admit more checksum-consistent wrong answers.</li>
 * </ul>
 */
public record ScannerConfig(
        double threshold,
        int candidatesPerGroup
) {
    public static final double DEFAULT_THRESHOLD = 0.4;
    public static final int DEFAULT_CANDIDATES_PER_GROUP = 3;

    public ScannerConfig {
        if (!(threshold > 0.0 && threshold < 1.0)) {
            throw new IllegalArgumentException("threshold must be in (0, 1): " + threshold);
        }
        if (candidatesPerGroup < 1 || candidatesPerGroup > 10) {
            throw new IllegalArgumentException("candidatesPerGroup must be 1-10: " + candidatesPerGroup);
        }
    }

    /**
     * Threshold 0.4, three candidates per group.
     */
    public static ScannerConfig defaults() {
        return new ScannerConfig(DEFAULT_THRESHOLD, DEFAULT_CANDIDATES_PER_GROUP);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int candidatesPerGroup = DEFAULT_CANDIDATES_PER_GROUP;

        public Builder withThreshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder withCandidatesPerGroup(int candidatesPerGroup) {
            this.candidatesPerGroup = candidatesPerGroup;
            return this;
        }

        public ScannerConfig build() {
            return new ScannerConfig(threshold, candidatesPerGroup);
        }
    }
}
