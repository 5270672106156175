package com.example.wheelcodereader.service.postprocess;

import com.example.wheelcodereader.config.RegionFilterConfig;
import com.example.wheelcodereader.model.BoundingQuad;
import com.example.wheelcodereader.model.TextObservation;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops observations whose geometry looks like a sticker or printed label
 * rather than text engraved on the hub. The image extent is inferred from the
 * observations themselves, so the filter needs no access to the image.
 */
public class RegionFilter {

    private static final Logger log = LoggerFactory.getLogger(RegionFilter.class);

    private final RegionFilterConfig config;

    public RegionFilter(RegionFilterConfig config) {
        this.config = config;
    }

    public List<TextObservation> apply(List<TextObservation> observations) {
        if (observations.isEmpty()) {
            return List.of();
        }

        double imageWidth = 0;
        double imageHeight = 0;
        for (TextObservation observation : observations) {
            Optional<BoundingQuad> quad = observation.usableQuad();
            if (quad.isPresent()) {
                imageWidth = Math.max(imageWidth, quad.get().maxX());
                imageHeight = Math.max(imageHeight, quad.get().maxY());
            }
        }

        if (imageWidth <= 0 || imageHeight <= 0) {
            log.warn("Unable to infer image extent from {} observations, skipping region filter", observations.size());
            return observations;
        }

        List<TextObservation> kept = new ArrayList<>();
        for (TextObservation observation : observations) {
            Optional<BoundingQuad> quad = observation.usableQuad();
            if (quad.isEmpty()) {
                kept.add(observation);
                continue;
            }
            RegionMetrics metrics = RegionMetrics.measure(observation.text(), quad.get(), imageWidth, imageHeight);
            List<String> reasons = rejectionReasons(metrics);
            if (reasons.isEmpty()) {
                kept.add(observation);
            } else {
                log.debug("Region filter dropped '{}': {}", observation.text(), String.join(", ", reasons));
            }
        }

        log.info("Region filter: {} -> {}", observations.size(), kept.size());
        return kept;
    }

    List<String> rejectionReasons(RegionMetrics metrics) {
        List<String> reasons = new ArrayList<>(boundViolations(metrics));
        if (!LabelHeuristic.looksEngraved(metrics)) {
            reasons.addAll(LabelHeuristic.reasons(metrics));
        }
        return reasons;
    }

    private List<String> boundViolations(RegionMetrics metrics) {
        List<String> violations = new ArrayList<>();
        if (metrics.areaRatio() < config.minAreaRatio()) {
            violations.add(String.format(Locale.ROOT, "area too small (%.4f)", metrics.areaRatio()));
        } else if (metrics.areaRatio() > config.maxAreaRatio()) {
            violations.add(String.format(Locale.ROOT, "area too large (%.4f)", metrics.areaRatio()));
        }
        if (metrics.aspectRatio() < config.minAspectRatio()) {
            violations.add(String.format(Locale.ROOT, "aspect too narrow (%.2f)", metrics.aspectRatio()));
        } else if (metrics.aspectRatio() > config.maxAspectRatio()) {
            violations.add(String.format(Locale.ROOT, "aspect too wide (%.2f)", metrics.aspectRatio()));
        }
        if (config.centerRegionOnly() && metrics.distRatio() > 1 - config.centerRegionRatio()) {
            violations.add(String.format(Locale.ROOT, "off center (%.2f)", metrics.distRatio()));
        }
        return violations;
    }
}
