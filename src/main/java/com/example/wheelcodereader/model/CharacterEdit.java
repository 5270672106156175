package com.example.wheelcodereader.model;

import java.util.Locale;

/**
 * Single character substitution applied by the confusion corrector.
 */
public record CharacterEdit(int position, char fromChar, char toChar) {

    public String describe() {
        return String.format(Locale.ROOT, "position %d: '%c' -> '%c'", position, fromChar, toChar);
    }
}
