package com.example.wheelcodereader.service.postprocess;

import com.example.wheelcodereader.util.TextSimilarity;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rules recognising sticker or label text that happens to sit on a wheel photo.
 * Each rule is a pure predicate over {@link RegionMetrics} and reports why it fired.
 */
public enum LabelHeuristic {

    LONG_NUMERIC_LABEL(metrics -> {
        if (TextSimilarity.isAllDigits(metrics.text()) && metrics.text().length() >= 7
                && inRange(metrics.aspectRatio(), 0.8, 3.0)) {
            return Optional.of(String.format(Locale.ROOT,
                    "long numeric label (aspect %.2f)", metrics.aspectRatio()));
        }
        return Optional.empty();
    }),

    LARGE_REGULAR_BLOB(metrics -> {
        if (metrics.areaRatio() > 0.015 && inRange(metrics.aspectRatio(), 0.8, 4.0)) {
            return Optional.of(String.format(Locale.ROOT,
                    "large regular region (area %.4f)", metrics.areaRatio()));
        }
        return Optional.empty();
    }),

    PERIPHERAL_STICKER(metrics -> {
        double edge = 0.15;
        boolean nearEdge = metrics.centerX() < metrics.imageWidth() * edge
                || metrics.centerX() > metrics.imageWidth() * (1 - edge)
                || metrics.centerY() < metrics.imageHeight() * edge
                || metrics.centerY() > metrics.imageHeight() * (1 - edge);
        if (nearEdge && metrics.areaRatio() > 0.005) {
            return Optional.of("close to image edge");
        }
        return Optional.empty();
    });

    /**
     * Engraved hub text occupies this area band; it is exempt from the label rules.
     */
    static final double ENGRAVED_MIN_AREA_RATIO = 0.0005;
    static final double ENGRAVED_MAX_AREA_RATIO = 0.008;

    private final Function<RegionMetrics, Optional<String>> rule;

    LabelHeuristic(Function<RegionMetrics, Optional<String>> rule) {
        this.rule = rule;
    }

    public Optional<String> evaluate(RegionMetrics metrics) {
        return rule.apply(metrics);
    }

    static List<String> reasons(RegionMetrics metrics) {
        return Arrays.stream(values())
                .map(heuristic -> heuristic.evaluate(metrics))
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    static boolean looksEngraved(RegionMetrics metrics) {
        return inRange(metrics.areaRatio(), ENGRAVED_MIN_AREA_RATIO, ENGRAVED_MAX_AREA_RATIO);
    }

    private static boolean inRange(double value, double min, double max) {
        return value >= min && value <= max;
    }
}
