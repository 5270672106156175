package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.FusionCandidate;
import com.example.wheelcodereader.model.FusionMethod;
import com.example.wheelcodereader.model.TextObservation;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores each distinct text by the sum of its confidences.
 */
class WeightedFusionStrategy implements FusionStrategy {

    private static final Logger log = LoggerFactory.getLogger(WeightedFusionStrategy.class);

    @Override
    public FusionMethod method() {
        return FusionMethod.WEIGHTED;
    }

    @Override
    public StrategyOutcome fuse(List<TextObservation> pool, double alternativeThreshold) {
        List<FusionCandidate> ranked = TextTally.rank(pool, TextTally::sumConfidence);

        FusionCandidate best = ranked.get(0);
        log.info("Weighted fusion selected '{}' (total weight {})", best.text(), best.score());
        return new StrategyOutcome(best.text(), best.avgConfidence(),
                TextTally.alternatives(ranked, alternativeThreshold));
    }
}
