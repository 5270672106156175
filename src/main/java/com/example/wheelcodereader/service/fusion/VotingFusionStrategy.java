package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.FusionCandidate;
import com.example.wheelcodereader.model.FusionMethod;
import com.example.wheelcodereader.model.TextObservation;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frequency vote weighted by average confidence, with a mild preference for longer texts.
 */
class VotingFusionStrategy implements FusionStrategy {

    private static final Logger log = LoggerFactory.getLogger(VotingFusionStrategy.class);

    @Override
    public FusionMethod method() {
        return FusionMethod.VOTING;
    }

    @Override
    public StrategyOutcome fuse(List<TextObservation> pool, double alternativeThreshold) {
        int poolSize = pool.size();
        List<FusionCandidate> ranked = TextTally.rank(pool, tally -> {
            double frequency = (double) tally.count() / poolSize;
            double lengthWeight = Math.min(tally.text().length() / 3.0, 1.5);
            return frequency * tally.averageConfidence() * lengthWeight;
        });

        FusionCandidate best = ranked.get(0);
        log.info("Voting fusion selected '{}' (score {}, frequency {})", best.text(), best.score(), best.frequency());
        return new StrategyOutcome(best.text(), best.avgConfidence(),
                TextTally.alternatives(ranked, alternativeThreshold));
    }
}
