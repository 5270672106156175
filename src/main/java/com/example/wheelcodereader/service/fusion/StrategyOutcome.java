package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.model.Alternative;
import java.util.List;

record StrategyOutcome(String text, double confidence, List<Alternative> alternatives) {

    StrategyOutcome {
        alternatives = List.copyOf(alternatives);
    }
}
