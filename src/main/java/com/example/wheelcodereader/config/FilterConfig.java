package com.example.wheelcodereader.config;

import java.util.Objects;

/**
 * Immutable snapshot of the per-image filtering settings.
 */
public record FilterConfig(
        double minConfidence,
        int minLength,
        int maxLength,
        boolean enableCharFilter,
        String allowedChars,
        boolean enableCorrection,
        boolean enableDeduplication,
        double similarityThreshold,
        int minResults,
        boolean enableRegionFilter,
        RegionFilterConfig regionFilter) {

    public FilterConfig {
        allowedChars = allowedChars == null ? "" : allowedChars;
        Objects.requireNonNull(regionFilter, "regionFilter");
        if (minLength > maxLength) {
            throw new IllegalArgumentException("minLength must not exceed maxLength");
        }
    }

    public static FilterConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .minConfidence(minConfidence)
                .minLength(minLength)
                .maxLength(maxLength)
                .enableCharFilter(enableCharFilter)
                .allowedChars(allowedChars)
                .enableCorrection(enableCorrection)
                .enableDeduplication(enableDeduplication)
                .similarityThreshold(similarityThreshold)
                .minResults(minResults)
                .enableRegionFilter(enableRegionFilter)
                .regionFilter(regionFilter);
    }

    public boolean hasAllowList() {
        return enableCharFilter && !allowedChars.isEmpty();
    }

    public static final class Builder {

        private double minConfidence = 0.6;
        private int minLength = 1;
        private int maxLength = 30;
        private boolean enableCharFilter = true;
        private String allowedChars = "";
        private boolean enableCorrection = true;
        private boolean enableDeduplication = true;
        private double similarityThreshold = 0.9;
        private int minResults = 0;
        private boolean enableRegionFilter = false;
        private RegionFilterConfig regionFilter = RegionFilterConfig.defaults();

        private Builder() {
        }

        public Builder minConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(int maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder enableCharFilter(boolean enableCharFilter) {
            this.enableCharFilter = enableCharFilter;
            return this;
        }

        public Builder allowedChars(String allowedChars) {
            this.allowedChars = allowedChars;
            return this;
        }

        public Builder enableCorrection(boolean enableCorrection) {
            this.enableCorrection = enableCorrection;
            return this;
        }

        public Builder enableDeduplication(boolean enableDeduplication) {
            this.enableDeduplication = enableDeduplication;
            return this;
        }

        public Builder similarityThreshold(double similarityThreshold) {
            this.similarityThreshold = similarityThreshold;
            return this;
        }

        public Builder minResults(int minResults) {
            this.minResults = minResults;
            return this;
        }

        public Builder enableRegionFilter(boolean enableRegionFilter) {
            this.enableRegionFilter = enableRegionFilter;
            return this;
        }

        public Builder regionFilter(RegionFilterConfig regionFilter) {
            this.regionFilter = regionFilter;
            return this;
        }

        public FilterConfig build() {
            return new FilterConfig(minConfidence, minLength, maxLength, enableCharFilter, allowedChars,
                    enableCorrection, enableDeduplication, similarityThreshold, minResults, enableRegionFilter,
                    regionFilter);
        }
    }
}
