package com.example.wheelcodereader.model;

import java.util.List;

/**
 * Outcome of recognizing one image: the ranked observations, their row
 * grouping and bookkeeping about the run. Failed results carry an error
 * message and empty lists.
 */
public record ImageRecognitionResult(
        boolean success,
        List<TextObservation> observations,
        List<Line> lines,
        String error,
        String engineUsed,
        long processingTimeMs) {

    public ImageRecognitionResult {
        observations = observations == null ? List.of() : List.copyOf(observations);
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static ImageRecognitionResult success(List<TextObservation> observations, List<Line> lines) {
        return new ImageRecognitionResult(true, observations, lines, null, null, 0L);
    }

    public static ImageRecognitionResult success(List<TextObservation> observations, List<Line> lines,
            String engineUsed, long processingTimeMs) {
        return new ImageRecognitionResult(true, observations, lines, null, engineUsed, processingTimeMs);
    }

    public static ImageRecognitionResult failure(String error) {
        return new ImageRecognitionResult(false, List.of(), List.of(), error, null, 0L);
    }

    public static ImageRecognitionResult failure(String error, String engineUsed, long processingTimeMs) {
        return new ImageRecognitionResult(false, List.of(), List.of(), error, engineUsed, processingTimeMs);
    }

    public int totalTexts() {
        return observations.size();
    }

    public int totalLines() {
        return lines.size();
    }
}
