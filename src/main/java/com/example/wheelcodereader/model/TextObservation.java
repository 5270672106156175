package com.example.wheelcodereader.model;

import java.util.Objects;
import java.util.Optional;

/**
 * One text region reported by an OCR engine. Instances are immutable; pipeline
 * stages derive new observations through the {@code with*} methods.
 *
 * @param text             recognized glyphs, possibly empty
 * @param confidence       recognition confidence in {@code [0, 1]}
 * @param quad             region geometry, {@code null} when the engine reported none
 * @param sourceImageIndex index of the image inside a multi-image batch
 * @param originalText     text before in-pipeline correction, {@code null} when uncorrected
 */
public record TextObservation(
        String text,
        double confidence,
        BoundingQuad quad,
        int sourceImageIndex,
        String originalText) {

    public TextObservation {
        text = text == null ? "" : text;
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Observation confidence must be a number");
        }
    }

    public static TextObservation of(String text, double confidence) {
        return new TextObservation(text, confidence, null, 0, null);
    }

    public static TextObservation of(String text, double confidence, BoundingQuad quad) {
        return new TextObservation(text, confidence, quad, 0, null);
    }

    public static TextObservation of(String text, double confidence, BoundingQuad quad, int sourceImageIndex) {
        return new TextObservation(text, confidence, quad, sourceImageIndex, null);
    }

    /**
     * @return the geometry when it is present and usable for measurements
     */
    public Optional<BoundingQuad> usableQuad() {
        return Optional.ofNullable(quad).filter(BoundingQuad::isUsable);
    }

    public boolean corrected() {
        return originalText != null;
    }

    public TextObservation withText(String newText) {
        return new TextObservation(newText, confidence, quad, sourceImageIndex, originalText);
    }

    public TextObservation withCorrection(String correctedText) {
        Objects.requireNonNull(correctedText, "correctedText");
        String original = originalText != null ? originalText : text;
        return new TextObservation(correctedText, confidence, quad, sourceImageIndex, original);
    }

    public TextObservation withConfidence(double newConfidence) {
        return new TextObservation(text, newConfidence, quad, sourceImageIndex, originalText);
    }

    public TextObservation withSourceImageIndex(int index) {
        return new TextObservation(text, confidence, quad, index, originalText);
    }
}
