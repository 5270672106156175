package com.example.wheelcodereader.config;

/**
 * Geometric bounds used to reject sticker or label text before ranking.
 * Ratios are relative to the image extent inferred from the observations.
 */
public record RegionFilterConfig(
        double minAreaRatio,
        double maxAreaRatio,
        double minAspectRatio,
        double maxAspectRatio,
        boolean centerRegionOnly,
        double centerRegionRatio) {

    private static final RegionFilterConfig DEFAULTS =
            new RegionFilterConfig(0.0001, 0.1, 0.2, 10.0, false, 0.6);

    public static RegionFilterConfig defaults() {
        return DEFAULTS;
    }
}
