package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.FusionMethod;
import com.example.wheelcodereader.model.TextObservation;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concatenates every distinct text, most confident first, instead of picking a winner.
 */
class MergeFusionStrategy implements FusionStrategy {

    private static final Logger log = LoggerFactory.getLogger(MergeFusionStrategy.class);

    @Override
    public FusionMethod method() {
        return FusionMethod.MERGE;
    }

    @Override
    public StrategyOutcome fuse(List<TextObservation> pool, double alternativeThreshold) {
        List<TextTally> distinct = TextTally.of(pool);
        distinct.sort(Comparator.comparingDouble(TextTally::maxConfidence).reversed());

        String merged = distinct.stream().map(TextTally::text).collect(Collectors.joining(" "));
        double confidence = distinct.stream().mapToDouble(TextTally::maxConfidence).average().orElse(0.0);

        log.info("Merge fusion produced '{}' (mean confidence {})", merged, confidence);
        return new StrategyOutcome(merged, confidence, List.of());
    }
}
