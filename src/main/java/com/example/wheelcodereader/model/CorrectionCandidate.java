package com.example.wheelcodereader.model;

import java.util.List;

/**
 * Candidate reading produced by the confusion corrector for one input text.
 *
 * @param patternMatch whether {@code text} matches one of the wheel-code grammars
 */
public record CorrectionCandidate(String text, double confidence, List<CharacterEdit> edits, boolean patternMatch) {

    public CorrectionCandidate {
        edits = List.copyOf(edits);
    }

    public int editCount() {
        return edits.size();
    }
}
