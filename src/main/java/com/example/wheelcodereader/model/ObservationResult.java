package com.example.wheelcodereader.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed outcome of one OCR engine call: either the observations it produced or
 * the error that prevented it from producing any.
 */
public final class ObservationResult {

    private final List<TextObservation> observations;
    private final OcrError error;

    private ObservationResult(List<TextObservation> observations, OcrError error) {
        this.observations = observations;
        this.error = error;
    }

    public static ObservationResult success(List<TextObservation> observations) {
        Objects.requireNonNull(observations, "observations");
        return new ObservationResult(List.copyOf(observations), null);
    }

    public static ObservationResult failure(String engine, String message) {
        return new ObservationResult(List.of(), new OcrError(engine, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public List<TextObservation> observations() {
        return observations;
    }

    public Optional<OcrError> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return highest confidence among the observations, or {@code 0.0} when there are none
     */
    public double bestConfidence() {
        return observations.stream().mapToDouble(TextObservation::confidence).max().orElse(0.0);
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ObservationResult[success, " + observations.size() + " observations]"
                : "ObservationResult[failure, " + error + "]";
    }
}
