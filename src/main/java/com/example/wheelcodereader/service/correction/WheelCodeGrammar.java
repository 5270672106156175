package com.example.wheelcodereader.service.correction;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Known layouts of codes engraved on wheel hubs.
 */
public final class WheelCodeGrammar {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^[A-Z]{2}\\d{5}$"),
            Pattern.compile("^[A-Z]{3}\\d{4}$"),
            Pattern.compile("^\\d{4}[A-Z]\\d$"),
            Pattern.compile("^\\d{4}[A-Z]{2}\\d$"));

    private WheelCodeGrammar() {
    }

    public static boolean matches(String text) {
        if (text == null) {
            return false;
        }
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(text).matches()) {
                return true;
            }
        }
        return false;
    }
}
