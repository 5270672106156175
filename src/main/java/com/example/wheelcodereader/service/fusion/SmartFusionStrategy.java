package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.Alternative;
import com.example.wheelcodereader.model.FusionMethod;
import com.example.wheelcodereader.model.TextObservation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trusts the single most confident observation of the pool.
 */
class SmartFusionStrategy implements FusionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SmartFusionStrategy.class);

    @Override
    public FusionMethod method() {
        return FusionMethod.SMART;
    }

    @Override
    public StrategyOutcome fuse(List<TextObservation> pool, double alternativeThreshold) {
        List<TextObservation> sorted = new ArrayList<>(pool);
        sorted.sort(Comparator.comparingDouble(TextObservation::confidence).reversed());

        TextObservation best = sorted.get(0);
        List<Alternative> alternatives = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(best.text());
        for (TextObservation observation : sorted.subList(1, sorted.size())) {
            if (!seen.contains(observation.text())
                    && observation.confidence() >= best.confidence() * alternativeThreshold) {
                alternatives.add(new Alternative(observation.text(), observation.confidence(), observation.confidence()));
                seen.add(observation.text());
            }
        }

        log.info("Smart fusion selected '{}' (confidence {})", best.text(), best.confidence());
        return new StrategyOutcome(best.text(), best.confidence(), alternatives);
    }
}
