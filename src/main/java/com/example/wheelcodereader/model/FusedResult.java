package com.example.wheelcodereader.model;

import java.util.List;

/**
 * Final answer of a multi-image fusion run. Callers must check {@link #success()}
 * before reading the other fields; failures only carry {@link #error()}.
 */
public record FusedResult(
        boolean success,
        String error,
        String mergedText,
        double confidence,
        int sourceCount,
        FusionMethod fusionMethod,
        List<Alternative> alternatives,
        List<FusedLine> lines) {

    public FusedResult {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static FusedResult failure(String error) {
        return new FusedResult(false, error, null, 0.0, 0, null, List.of(), List.of());
    }

    public int totalLines() {
        return lines.size();
    }

    /**
     * @return number of whitespace separated tokens in the merged text
     */
    public int totalMergedTexts() {
        if (mergedText == null || mergedText.isBlank()) {
            return 0;
        }
        return mergedText.trim().split("\\s+").length;
    }
}
