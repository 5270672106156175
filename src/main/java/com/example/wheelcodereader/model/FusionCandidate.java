package com.example.wheelcodereader.model;

/**
 * Scored text produced while fusing several images. {@code frequency} is the
 * share of the observation pool carrying this exact text.
 */
public record FusionCandidate(String text, double score, int count, double frequency, double avgConfidence) {
}
