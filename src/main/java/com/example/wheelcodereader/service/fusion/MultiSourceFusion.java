package com.example.wheelcodereader.service.fusion;

import com.example.wheelcodereader.config.FusionConfig;
import com.example.wheelcodereader.model.FusedLine;
import com.example.wheelcodereader.model.FusedResult;
import com.example.wheelcodereader.model.FusionMethod;
import com.example.wheelcodereader.model.ImageRecognitionResult;
import com.example.wheelcodereader.model.TextObservation;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the per-image results of one object photographed several times into
 * a single answer. The order of {@code results} defines each observation's
 * source image index and the row alignment of the line fusion, so callers
 * must keep submission order. Failures are reported through
 * {@link FusedResult#failure(String)}, never thrown.
 */
@Component
public class MultiSourceFusion {

    private static final Logger log = LoggerFactory.getLogger(MultiSourceFusion.class);

    private final Map<FusionMethod, FusionStrategy> strategies = new EnumMap<>(FusionMethod.class);
    private final PositionalLineFusion lineFusion = new PositionalLineFusion();

    public MultiSourceFusion() {
        register(new VotingFusionStrategy());
        register(new WeightedFusionStrategy());
        register(new SmartFusionStrategy());
        register(new MergeFusionStrategy());
    }

    private void register(FusionStrategy strategy) {
        strategies.put(strategy.method(), strategy);
    }

    public FusedResult fuse(List<ImageRecognitionResult> results, FusionConfig config) {
        if (results == null || results.isEmpty()) {
            return FusedResult.failure("No recognition results to fuse");
        }

        Optional<FusionMethod> method = FusionMethod.fromName(config.fusionMethod());
        if (method.isEmpty()) {
            log.error("Unsupported fusion method: {}", config.fusionMethod());
            return FusedResult.failure("Unsupported fusion method: " + config.fusionMethod());
        }

        Optional<String> invalid = invalidSetting(config);
        if (invalid.isPresent()) {
            log.error("Invalid fusion configuration: {}", invalid.get());
            return FusedResult.failure("Invalid fusion configuration: " + invalid.get());
        }

        if (results.size() < config.minImages()) {
            log.warn("Only {} images supplied, at least {} are recommended", results.size(), config.minImages());
        }
        List<ImageRecognitionResult> used = results;
        if (results.size() > config.maxImages()) {
            log.warn("{} images supplied, only the first {} are used", results.size(), config.maxImages());
            used = results.subList(0, config.maxImages());
        }

        List<TextObservation> pool = flatten(used);
        if (pool.isEmpty()) {
            return FusedResult.failure("Recognition failed for all images");
        }

        StrategyOutcome outcome = strategies.get(method.get()).fuse(pool, config.alternativeThreshold());
        List<FusedLine> lines = lineFusion.fuse(used);

        return new FusedResult(
                true,
                null,
                outcome.text(),
                outcome.confidence(),
                used.size(),
                method.get(),
                config.returnAlternatives() ? outcome.alternatives() : List.of(),
                lines);
    }

    private static Optional<String> invalidSetting(FusionConfig config) {
        if (config.maxImages() < 1) {
            return Optional.of("max_images must be at least 1 but was " + config.maxImages());
        }
        if (config.minImages() < 0) {
            return Optional.of("min_images must not be negative but was " + config.minImages());
        }
        double threshold = config.alternativeThreshold();
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            return Optional.of("alternative_threshold must be within [0, 1] but was " + threshold);
        }
        return Optional.empty();
    }

    private static List<TextObservation> flatten(List<ImageRecognitionResult> results) {
        List<TextObservation> pool = new ArrayList<>();
        for (int index = 0; index < results.size(); index++) {
            ImageRecognitionResult result = results.get(index);
            if (!result.success()) {
                continue;
            }
            for (TextObservation observation : result.observations()) {
                pool.add(observation.withSourceImageIndex(index));
            }
        }
        return pool;
    }
}
