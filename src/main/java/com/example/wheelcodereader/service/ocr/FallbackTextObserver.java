package com.example.wheelcodereader.service.ocr;

import com.example.wheelcodereader.model.ObservationResult;
import java.awt.image.BufferedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consults a secondary engine, typically a cloud OCR service, when the primary
 * engine fails or is not confident enough. A failing secondary never hides a
 * usable primary result.
 */
public class FallbackTextObserver implements TextObserver {

    private static final Logger log = LoggerFactory.getLogger(FallbackTextObserver.class);

    private final TextObserver primary;
    private final TextObserver secondary;
    private final double confidenceThreshold;

    public FallbackTextObserver(TextObserver primary, TextObserver secondary, double confidenceThreshold) {
        this.primary = primary;
        this.secondary = secondary;
        this.confidenceThreshold = confidenceThreshold;
    }

    @Override
    public String name() {
        return primary.name() + "+" + secondary.name();
    }

    @Override
    public ObservationResult observe(BufferedImage image) {
        ObservationResult primaryResult = primary.observe(image);
        if (primaryResult.isSuccess() && primaryResult.bestConfidence() >= confidenceThreshold) {
            return primaryResult;
        }

        log.info("Primary OCR engine {} {}, consulting {}", primary.name(),
                primaryResult.isSuccess() ? "below confidence " + confidenceThreshold : "failed",
                secondary.name());
        ObservationResult secondaryResult = secondary.observe(image);
        if (secondaryResult.isSuccess() && !secondaryResult.observations().isEmpty()) {
            return secondaryResult;
        }

        secondaryResult.error().ifPresent(error ->
                log.warn("Fallback OCR engine {} failed: {}", error.engine(), error.message()));
        return primaryResult.isSuccess() || !secondaryResult.isSuccess() ? primaryResult : secondaryResult;
    }
}
