package com.example.wheelcodereader.service.postprocess;

import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Single-pass look-alike correction used inside the filter pipeline. Rules are
 * grouped in ordered tiers; within a tier only the first applicable rule runs,
 * and each tier sees the output of the previous one.
 */
public class InlineCharacterCorrector {

    static final Map<Character, Character> LETTER_TO_DIGIT = Map.ofEntries(
            Map.entry('O', '0'),
            Map.entry('Q', '0'),
            Map.entry('D', '0'),
            Map.entry('I', '1'),
            Map.entry('l', '1'),
            Map.entry('Z', '2'),
            Map.entry('A', '4'),
            Map.entry('S', '5'),
            Map.entry('G', '6'),
            Map.entry('T', '7'),
            Map.entry('B', '8'),
            Map.entry('g', '9'),
            Map.entry('q', '9'));

    private static final Pattern UPPER_ALPHANUMERIC = Pattern.compile("[A-Z0-9]{3,}");
    private static final String CODE_PREFIX = "AT";

    private static final CorrectionRule MOSTLY_LETTERS = new CorrectionRule() {
        @Override
        public boolean appliesTo(String text) {
            return share(text, Character::isLetter) > 0.6;
        }

        @Override
        public String apply(String text) {
            return text.replace('0', 'O').replace('1', 'I').replace('5', 'S');
        }
    };

    private static final CorrectionRule MOSTLY_DIGITS = new CorrectionRule() {
        @Override
        public boolean appliesTo(String text) {
            return share(text, Character::isDigit) > 0.6;
        }

        @Override
        public String apply(String text) {
            return text.replace('O', '0').replace('I', '1');
        }
    };

    private static final CorrectionRule PREFIXED_CODE = new CorrectionRule() {
        @Override
        public boolean appliesTo(String text) {
            return text.length() >= 7 && text.startsWith(CODE_PREFIX);
        }

        @Override
        public String apply(String text) {
            char[] chars = text.toCharArray();
            for (int i = CODE_PREFIX.length(); i < chars.length; i++) {
                if (Character.isLetter(chars[i])) {
                    chars[i] = LETTER_TO_DIGIT.getOrDefault(chars[i], chars[i]);
                }
            }
            return new String(chars);
        }
    };

    private static final CorrectionRule LETTER_BETWEEN_DIGITS = new CorrectionRule() {
        @Override
        public boolean appliesTo(String text) {
            return UPPER_ALPHANUMERIC.matcher(text).matches();
        }

        @Override
        public String apply(String text) {
            char[] chars = text.toCharArray();
            for (int i = 1; i < chars.length - 1; i++) {
                if (Character.isDigit(chars[i - 1]) && Character.isDigit(chars[i + 1])) {
                    chars[i] = flankedReplacement(chars[i]);
                }
            }
            return new String(chars);
        }
    };

    private static final List<List<CorrectionRule>> TIERS = List.of(
            List.of(MOSTLY_LETTERS, MOSTLY_DIGITS),
            List.of(PREFIXED_CODE, LETTER_BETWEEN_DIGITS));

    public String correct(String text) {
        String corrected = text;
        for (List<CorrectionRule> tier : TIERS) {
            for (CorrectionRule rule : tier) {
                if (rule.appliesTo(corrected)) {
                    corrected = rule.apply(corrected);
                    break;
                }
            }
        }
        return corrected;
    }

    private static char flankedReplacement(char c) {
        // between two digits an upper-case L is almost always a 4
        if (c == 'L') {
            return '4';
        }
        return LETTER_TO_DIGIT.getOrDefault(c, c);
    }

    private static double share(String text, IntPredicate predicate) {
        if (text.isEmpty()) {
            return 0.0;
        }
        long matching = text.chars().filter(predicate).count();
        return (double) matching / text.length();
    }
}
