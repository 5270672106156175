package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.Alternative;
import com.example.wheelcodereader.model.FusionCandidate;
import com.example.wheelcodereader.model.TextObservation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Exact-text tally of an observation pool, in first-seen order.
 */
final class TextTally {

    private final String text;
    private int count;
    private double sumConfidence;
    private double maxConfidence = Double.NEGATIVE_INFINITY;

    private TextTally(String text) {
        this.text = text;
    }

    static List<TextTally> of(List<TextObservation> pool) {
        Map<String, TextTally> tallies = new LinkedHashMap<>();
        for (TextObservation observation : pool) {
            tallies.computeIfAbsent(observation.text(), TextTally::new).observe(observation.confidence());
        }
        return new ArrayList<>(tallies.values());
    }

    private void observe(double confidence) {
        count++;
        sumConfidence += confidence;
        maxConfidence = Math.max(maxConfidence, confidence);
    }

    String text() {
        return text;
    }

    int count() {
        return count;
    }

    double sumConfidence() {
        return sumConfidence;
    }

    double maxConfidence() {
        return maxConfidence;
    }

    double averageConfidence() {
        return count == 0 ? 0.0 : sumConfidence / count;
    }

    FusionCandidate toCandidate(double score, int poolSize) {
        return new FusionCandidate(text, score, count, (double) count / poolSize, averageConfidence());
    }

    /**
     * Keeps the runner-ups of a score-sorted candidate list whose score reaches
     * {@code threshold} times the winner's.
     */
    static List<Alternative> alternatives(List<FusionCandidate> ranked, double threshold) {
        List<Alternative> alternatives = new ArrayList<>();
        if (ranked.isEmpty()) {
            return alternatives;
        }
        double bestScore = ranked.get(0).score();
        for (FusionCandidate candidate : ranked.subList(1, ranked.size())) {
            if (candidate.score() >= bestScore * threshold) {
                alternatives.add(new Alternative(candidate.text(), candidate.score(), candidate.avgConfidence()));
            }
        }
        return alternatives;
    }

    static List<FusionCandidate> rank(List<TextObservation> pool, ToDoubleFunction<TextTally> scorer) {
        List<FusionCandidate> ranked = new ArrayList<>();
        for (TextTally tally : of(pool)) {
            ranked.add(tally.toCandidate(scorer.applyAsDouble(tally), pool.size()));
        }
        ranked.sort((left, right) -> Double.compare(right.score(), left.score()));
        return ranked;
    }
}
