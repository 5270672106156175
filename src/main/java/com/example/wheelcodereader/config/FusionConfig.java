package com.example.wheelcodereader.config;

/**
 * Immutable snapshot of the multi-image fusion settings. The method is kept as
 * the configured name so that unknown values surface as a failed fusion
 * instead of a binding error.
 */
public record FusionConfig(
        String fusionMethod,
        int minImages,
        int maxImages,
        boolean returnAlternatives,
        double alternativeThreshold) {

    private static final FusionConfig DEFAULTS = new FusionConfig("voting", 2, 10, true, 0.85);

    public static FusionConfig defaults() {
        return DEFAULTS;
    }

    public FusionConfig withFusionMethod(String method) {
        return new FusionConfig(method, minImages, maxImages, returnAlternatives, alternativeThreshold);
    }

    public FusionConfig withMaxImages(int max) {
        return new FusionConfig(fusionMethod, minImages, max, returnAlternatives, alternativeThreshold);
    }

    public FusionConfig withReturnAlternatives(boolean enabled) {
        return new FusionConfig(fusionMethod, minImages, maxImages, enabled, alternativeThreshold);
    }
}
