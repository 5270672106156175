package com.example.wheelcodereader.service.postprocess;

import com.example.wheelcodereader.config.FilterConfig;
import com.example.wheelcodereader.model.TextObservation;
import com.example.wheelcodereader.util.TextSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the raw observations of one image into a ranked, deduplicated list of
 * candidate codes. Stages run in a fixed order and each one only sees what the
 * previous stage kept: region, confidence, length, allow-list, correction,
 * deduplication, backfill and finally ranking. Inputs are never mutated.
 */
@Component
public class ResultFilterPipeline {

    private static final Logger log = LoggerFactory.getLogger(ResultFilterPipeline.class);

    private static final Pattern PREFIXED_CODE = Pattern.compile("^AT[0-9]{3,}$");
    private static final int BACKFILL_MIN_LENGTH = 4;

    private final InlineCharacterCorrector corrector = new InlineCharacterCorrector();

    public List<TextObservation> process(List<TextObservation> observations, FilterConfig config) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }

        List<TextObservation> results = List.copyOf(observations);
        if (config.enableRegionFilter()) {
            results = new RegionFilter(config.regionFilter()).apply(results);
        }
        results = filterByConfidence(results, config);
        results = filterByLength(results, config);
        if (config.hasAllowList()) {
            results = filterByAllowedChars(results, config.allowedChars());
        }
        if (config.enableCorrection()) {
            results = correctCharacters(results);
        }
        if (config.enableDeduplication()) {
            results = deduplicate(results, config.similarityThreshold());
        }
        if (config.minResults() > 0 && results.size() < config.minResults()) {
            results = backfill(results, observations, config);
        }
        return rank(results);
    }

    /**
     * Ranking score of a candidate: its confidence plus bonuses for the
     * {@code AT} code prefix, a typical code length and an all-digit text.
     */
    public static double rankingScore(TextObservation observation) {
        String text = observation.text();
        double bonus = 0.0;
        if (PREFIXED_CODE.matcher(text).matches()) {
            bonus += 2.0;
        } else if (text.startsWith("AT")) {
            bonus += 1.5;
        }
        if (text.length() >= 6 && text.length() <= 8) {
            bonus += 0.5;
        }
        if (TextSimilarity.isAllDigits(text)) {
            bonus += 0.5;
        }
        return observation.confidence() + bonus;
    }

    private List<TextObservation> filterByConfidence(List<TextObservation> results, FilterConfig config) {
        List<TextObservation> filtered = new ArrayList<>();
        for (TextObservation result : results) {
            if (result.confidence() >= config.minConfidence()) {
                filtered.add(result);
            } else {
                log.debug("Dropping low confidence result '{}' ({})", result.text(), result.confidence());
            }
        }
        log.info("Confidence filter: {} -> {}", results.size(), filtered.size());
        return filtered;
    }

    private List<TextObservation> filterByLength(List<TextObservation> results, FilterConfig config) {
        List<TextObservation> filtered = new ArrayList<>();
        for (TextObservation result : results) {
            int length = result.text().trim().length();
            if (length >= config.minLength() && length <= config.maxLength()) {
                filtered.add(result);
            } else {
                log.debug("Dropping result '{}' with length {}", result.text(), length);
            }
        }
        log.info("Length filter: {} -> {}", results.size(), filtered.size());
        return filtered;
    }

    private List<TextObservation> filterByAllowedChars(List<TextObservation> results, String allowedChars) {
        List<TextObservation> filtered = new ArrayList<>();
        for (TextObservation result : results) {
            String stripped = retainAllowed(result.text(), allowedChars);
            if (stripped.isEmpty()) {
                log.debug("Dropping result '{}' without allowed characters", result.text());
            } else if (stripped.equals(result.text())) {
                filtered.add(result);
            } else {
                log.debug("Character filter: '{}' -> '{}'", result.text(), stripped);
                filtered.add(result.withText(stripped));
            }
        }
        log.info("Character filter: {} -> {}", results.size(), filtered.size());
        return filtered;
    }

    private List<TextObservation> correctCharacters(List<TextObservation> results) {
        List<TextObservation> corrected = new ArrayList<>(results.size());
        for (TextObservation result : results) {
            String text = corrector.correct(result.text());
            if (text.equals(result.text())) {
                corrected.add(result);
            } else {
                log.debug("Character correction: '{}' -> '{}'", result.text(), text);
                corrected.add(result.withCorrection(text));
            }
        }
        return corrected;
    }

    private List<TextObservation> deduplicate(List<TextObservation> results, double threshold) {
        List<TextObservation> unique = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        for (TextObservation result : results) {
            String duplicateOf = findSimilar(result.text(), seen, threshold);
            if (duplicateOf != null) {
                log.debug("Dropping duplicate '{}' (similar to '{}')", result.text(), duplicateOf);
                continue;
            }
            unique.add(result);
            seen.add(result.text());
        }
        log.info("Deduplication: {} -> {}", results.size(), unique.size());
        return unique;
    }

    private List<TextObservation> backfill(List<TextObservation> results, List<TextObservation> original,
            FilterConfig config) {
        List<TextObservation> byConfidence = new ArrayList<>(original);
        byConfidence.sort(Comparator.comparingDouble(TextObservation::confidence).reversed());

        List<TextObservation> supplemented = new ArrayList<>(results);
        List<String> existing = new ArrayList<>();
        results.forEach(result -> existing.add(result.text()));

        for (TextObservation candidate : byConfidence) {
            if (supplemented.size() >= config.minResults()) {
                break;
            }
            String text = config.hasAllowList()
                    ? retainAllowed(candidate.text(), config.allowedChars())
                    : candidate.text();
            if (text.length() < BACKFILL_MIN_LENGTH
                    || findSimilar(text, existing, config.similarityThreshold()) != null) {
                continue;
            }
            supplemented.add(candidate.withText(text));
            existing.add(text);
        }

        log.info("Backfill to {} results: {} -> {}", config.minResults(), results.size(), supplemented.size());
        return supplemented.size() > config.minResults()
                ? supplemented.subList(0, config.minResults())
                : supplemented;
    }

    private List<TextObservation> rank(List<TextObservation> results) {
        List<TextObservation> ranked = new ArrayList<>(results);
        ranked.sort(Comparator.comparingDouble(ResultFilterPipeline::rankingScore).reversed());
        return List.copyOf(ranked);
    }

    private static String findSimilar(String text, List<String> candidates, double threshold) {
        for (String candidate : candidates) {
            if (TextSimilarity.similarity(text, candidate) >= threshold) {
                return candidate;
            }
        }
        return null;
    }

    private static String retainAllowed(String text, String allowedChars) {
        StringBuilder builder = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (allowedChars.indexOf(c) >= 0) {
                builder.append(c);
            }
        }
        return builder.toString();
    }
}
