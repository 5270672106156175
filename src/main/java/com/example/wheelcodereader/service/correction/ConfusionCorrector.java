package com.example.wheelcodereader.service.correction;

import com.example.wheelcodereader.model.CharacterEdit;
import com.example.wheelcodereader.model.CorrectedReading;
import com.example.wheelcodereader.model.CorrectionCandidate;
import com.example.wheelcodereader.model.TextObservation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-ranks a single OCR reading by substituting characters commonly confused
 * on engraved metal and checking the results against {@link WheelCodeGrammar}.
 * The search is bounded to two simultaneous substitutions.
 */
@Component
public class ConfusionCorrector {

    private static final Logger log = LoggerFactory.getLogger(ConfusionCorrector.class);

    static final Map<Character, List<Character>> CONFUSIONS = Map.ofEntries(
            Map.entry('0', List.of('O', 'Q', 'D')),
            Map.entry('O', List.of('0', 'Q', 'D')),
            Map.entry('1', List.of('I', 'l', '|', 'i')),
            Map.entry('I', List.of('1', 'l', '|')),
            Map.entry('2', List.of('Z', '3')),
            Map.entry('3', List.of('8', '2')),
            Map.entry('4', List.of('A', '6')),
            Map.entry('5', List.of('S', '6')),
            Map.entry('6', List.of('G', '8', '5', '4', '9')),
            Map.entry('7', List.of('T', '1', '6')),
            Map.entry('8', List.of('B', '3', '6')),
            Map.entry('9', List.of('g', 'q', '6')),
            Map.entry('B', List.of('8', 'R')),
            Map.entry('G', List.of('6', 'C')),
            Map.entry('S', List.of('5', '8')),
            Map.entry('Z', List.of('2', '7')),
            Map.entry('T', List.of('7', '1')),
            Map.entry('A', List.of('4')));

    static final int MAX_CANDIDATES = 5;
    private static final int TWO_EDIT_MIN_LENGTH = 5;
    private static final double ORIGINAL_MATCH_BOOST = 1.2;
    private static final double CORRECTED_MATCH_BOOST = 1.5;
    private static final double PER_EDIT_PENALTY = 0.9;

    private static final Comparator<CorrectionCandidate> RANKING = Comparator
            .comparing(CorrectionCandidate::patternMatch)
            .thenComparingDouble(CorrectionCandidate::confidence)
            .reversed();

    /**
     * Produces up to five candidates for {@code text}, best first. When the text
     * already matches a grammar it is returned alone with a boosted confidence.
     */
    public List<CorrectionCandidate> correct(String text, double confidence) {
        String input = text == null ? "" : text;
        if (WheelCodeGrammar.matches(input)) {
            log.debug("'{}' already matches a wheel code pattern", input);
            return List.of(new CorrectionCandidate(input, confidence * ORIGINAL_MATCH_BOOST, List.of(), true));
        }

        List<CorrectionCandidate> candidates = new ArrayList<>();
        candidates.add(new CorrectionCandidate(input, confidence, List.of(), false));
        for (List<CharacterEdit> edits : substitutions(input)) {
            String candidate = applyEdits(input, edits);
            boolean patternMatch = WheelCodeGrammar.matches(candidate);
            double score = patternMatch
                    ? confidence * CORRECTED_MATCH_BOOST
                    : confidence * Math.pow(PER_EDIT_PENALTY, edits.size());
            if (patternMatch) {
                log.debug("Correction '{}' -> '{}' matches a wheel code pattern", input, candidate);
            }
            candidates.add(new CorrectionCandidate(candidate, score, edits, patternMatch));
        }

        candidates.sort(RANKING);
        return List.copyOf(candidates.subList(0, Math.min(MAX_CANDIDATES, candidates.size())));
    }

    /**
     * Replaces each observation by its best candidate, keeping the original text
     * and, when the text changed, up to two runner-up readings.
     */
    public List<CorrectedReading> batchCorrect(List<TextObservation> observations) {
        List<CorrectedReading> corrected = new ArrayList<>(observations.size());
        for (TextObservation observation : observations) {
            List<CorrectionCandidate> candidates = correct(observation.text(), observation.confidence());
            CorrectionCandidate best = candidates.get(0);
            List<String> alternatives = best.edits().isEmpty()
                    ? List.of()
                    : candidates.stream()
                            .skip(1)
                            .limit(2)
                            .map(CorrectionCandidate::text)
                            .collect(Collectors.toList());
            TextObservation rewritten = observation.withText(best.text()).withConfidence(best.confidence());
            if (!best.edits().isEmpty()) {
                log.info("Corrected '{}' -> '{}' (confidence {}): {}", observation.text(), best.text(),
                        best.confidence(), describeEdits(best.edits()));
            }
            corrected.add(new CorrectedReading(rewritten, observation.text(), best.patternMatch(), best.edits(),
                    alternatives));
        }
        return corrected;
    }

    private List<List<CharacterEdit>> substitutions(String text) {
        List<List<CharacterEdit>> substitutions = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            char from = text.charAt(i);
            for (char to : CONFUSIONS.getOrDefault(from, List.of())) {
                substitutions.add(List.of(new CharacterEdit(i, from, to)));
            }
        }

        if (text.length() >= TWO_EDIT_MIN_LENGTH) {
            for (int i = 0; i < text.length(); i++) {
                char first = text.charAt(i);
                for (char firstTo : CONFUSIONS.getOrDefault(first, List.of())) {
                    for (int j = i + 1; j < text.length(); j++) {
                        char second = text.charAt(j);
                        for (char secondTo : CONFUSIONS.getOrDefault(second, List.of())) {
                            substitutions.add(List.of(
                                    new CharacterEdit(i, first, firstTo),
                                    new CharacterEdit(j, second, secondTo)));
                        }
                    }
                }
            }
        }
        return substitutions;
    }

    static String describeEdits(List<CharacterEdit> edits) {
        return edits.stream().map(CharacterEdit::describe).collect(Collectors.joining(", "));
    }

    private static String applyEdits(String text, List<CharacterEdit> edits) {
        char[] chars = text.toCharArray();
        for (CharacterEdit edit : edits) {
            chars[edit.position()] = edit.toChar();
        }
        return new String(chars);
    }
}
