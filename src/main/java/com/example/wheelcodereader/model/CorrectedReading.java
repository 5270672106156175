package com.example.wheelcodereader.model;

import java.util.List;

/**
 * Observation rewritten to the best correction candidate, keeping the
 * original text and up to two runner-up readings.
 */
public record CorrectedReading(
        TextObservation observation,
        String originalText,
        boolean patternMatch,
        List<CharacterEdit> corrections,
        List<String> alternatives) {

    public CorrectedReading {
        corrections = List.copyOf(corrections);
        alternatives = List.copyOf(alternatives);
    }

    public boolean changed() {
        return !corrections.isEmpty();
    }
}
