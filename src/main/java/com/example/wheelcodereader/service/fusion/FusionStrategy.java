package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.FusionMethod;
import com.example.wheelcodereader.model.TextObservation;
import java.util.List;

/**
 * Picks one answer out of the flattened observation pool of several images.
 */
interface FusionStrategy {

    FusionMethod method();

    /**
     * @param pool                 every observation of every successful image, never empty
     * @param alternativeThreshold fraction of the winning score a runner-up must reach
     */
    StrategyOutcome fuse(List<TextObservation> pool, double alternativeThreshold);
}
